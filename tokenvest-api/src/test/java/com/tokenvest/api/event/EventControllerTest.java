package com.tokenvest.api.event;

import com.tokenvest.api.support.TestClockConfiguration;
import com.tokenvest.core.event.VestingEventLog.EventEntry;
import com.tokenvest.core.event.VestingEventLog.EventType;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.event.ApplicationEvents;
import org.springframework.test.context.event.RecordApplicationEvents;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import static com.tokenvest.api.vesting.VestingController.CALLER_HEADER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = "tokenvest.total-supply=1000000")
@AutoConfigureMockMvc
@Import(TestClockConfiguration.class)
@RecordApplicationEvents
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
class EventControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ApplicationEvents applicationEvents;

    @Test
    void committedOperationsAreLoggedAndPublished() throws Exception {
        swap(100).andExpect(status().isOk());
        swap(200).andExpect(status().isOk());

        mockMvc.perform(get("/api/v1/events").param("type", "swapped"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[1].details.amount").value("200"))
                .andExpect(jsonPath("$[1].details.pool").value("GameTreasury"));

        mockMvc.perform(get("/api/v1/events/verify"))
                .andExpect(jsonPath("$.valid").value(true))
                .andExpect(jsonPath("$.entriesVerified").value(2));

        assertThat(applicationEvents.stream(EventEntry.class))
                .extracting(entry -> entry.event().type())
                .containsExactly(EventType.SWAPPED, EventType.SWAPPED);
    }

    @Test
    void failedOperationsLeaveNoEvents() throws Exception {
        swap(500_000).andExpect(status().isUnprocessableEntity());

        mockMvc.perform(get("/api/v1/events"))
                .andExpect(jsonPath("$", hasSize(0)));
        assertThat(applicationEvents.stream(EventEntry.class)).isEmpty();
    }

    @Test
    void unknownEventTypeIsInvalid() throws Exception {
        mockMvc.perform(get("/api/v1/events").param("type", "minted"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VEST_002"));
    }

    private ResultActions swap(long amount) throws Exception {
        return mockMvc.perform(post("/api/v1/pools/GameTreasury/swaps")
                .header(CALLER_HEADER, "0xscript")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"to\":\"0xplayer\",\"amount\":" + amount + "}"));
    }
}
