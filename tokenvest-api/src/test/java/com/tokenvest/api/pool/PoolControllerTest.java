package com.tokenvest.api.pool;

import com.tokenvest.api.support.TestClockConfiguration;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.web.servlet.MockMvc;

import static com.tokenvest.api.vesting.VestingController.CALLER_HEADER;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = "tokenvest.total-supply=1000000")
@AutoConfigureMockMvc
@Import(TestClockConfiguration.class)
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
class PoolControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void listsDefaultAllocation() throws Exception {
        mockMvc.perform(get("/api/v1/pools"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(8)))
                .andExpect(jsonPath("$[0].label").value("Seed"))
                .andExpect(jsonPath("$[0].authorizedCapacity").value(50_000));

        mockMvc.perform(get("/api/v1/pools/summary"))
                .andExpect(jsonPath("$.totalSupply").value(1_000_000))
                .andExpect(jsonPath("$.totalCapacity").value(1_000_000));
    }

    @Test
    void scriptSwapsFromLiquidityPool() throws Exception {
        mockMvc.perform(post("/api/v1/pools/game-treasury/swaps")
                        .header(CALLER_HEADER, "0xscript")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"to\":\"0xplayer\",\"amount\":1500}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.label").value("GameTreasury"))
                .andExpect(jsonPath("$.usedAmount").value(1_500));
    }

    @Test
    void swapFromVestingPoolIsInvalid() throws Exception {
        mockMvc.perform(post("/api/v1/pools/Seed/swaps")
                        .header(CALLER_HEADER, "0xscript")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"to\":\"0xplayer\",\"amount\":10}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VEST_002"));
    }

    @Test
    void swapBeyondCapacityIsUnprocessable() throws Exception {
        mockMvc.perform(post("/api/v1/pools/GameTreasury/swaps")
                        .header(CALLER_HEADER, "0xscript")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"to\":\"0xplayer\",\"amount\":200001}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("VEST_004"));

        mockMvc.perform(get("/api/v1/pools/GameTreasury"))
                .andExpect(jsonPath("$.usedAmount").value(0));
    }

    @Test
    void adminMovesReserveCapacity() throws Exception {
        mockMvc.perform(post("/api/v1/pools/PlayRewards/liquidity")
                        .header(CALLER_HEADER, "0xadmin")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"amount\":50000}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].authorizedCapacity").value(300_000))
                .andExpect(jsonPath("$[1].label").value("Reserve"))
                .andExpect(jsonPath("$[1].authorizedCapacity").value(100_000));
    }

    @Test
    void distributionRequiresApprovedContract() throws Exception {
        mockMvc.perform(post("/api/v1/pools/Team/distributions")
                        .header(CALLER_HEADER, "0xadmin")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"to\":\"0xalice\",\"amount\":10}"))
                .andExpect(status().isForbidden());
    }

    @Test
    void missingAmountFailsValidation() throws Exception {
        mockMvc.perform(post("/api/v1/pools/GameTreasury/swaps")
                        .header(CALLER_HEADER, "0xscript")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"to\":\"0xplayer\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VEST_002"));
    }

    @Test
    void unknownPoolIsInvalid() throws Exception {
        mockMvc.perform(get("/api/v1/pools/Marketing"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Unknown pool: MARKETING"));
    }
}
