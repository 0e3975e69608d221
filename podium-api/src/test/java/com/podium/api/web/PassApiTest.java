package com.podium.api.web;

import com.jayway.jsonpath.JsonPath;
import com.podium.domain.account.Address;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasItem;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class PassApiTest {

  @Autowired MockMvc mvc;

  private void faucet(String account, long amount) throws Exception {
    mvc.perform(post("/api/v1/dev/faucet")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"account\":\"" + account + "\",\"amount\":" + amount + "}"))
        .andExpect(status().isOk());
  }

  @Test
  void buyThenSellRoundTrip() throws Exception {
    String target = "0x1001";
    String buyer = "0x1002";
    faucet(buyer, 1_000_000_000L);

    mvc.perform(get("/api/v1/passes/{target}/quote/buy", target).param("amount", "3"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.basePrice").value(400_000_000L))
        .andExpect(jsonPath("$.callerAmount").value(448_000_000L));

    mvc.perform(post("/api/v1/passes/{target}/buy", target)
            .header(Callers.HEADER, buyer)
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"amount\":3}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.supplyAfter").value(3))
        .andExpect(jsonPath("$.account").value(Address.of(buyer).value()))
        .andExpect(jsonPath("$.quote.protocolFee").value(16_000_000L));

    mvc.perform(get("/api/v1/passes/{target}/balance/{account}", target, buyer))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.balance").value(3));

    mvc.perform(post("/api/v1/passes/{target}/sell", target)
            .header(Callers.HEADER, buyer)
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"amount\":3}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.supplyAfter").value(0))
        .andExpect(jsonPath("$.quote.callerAmount").value(352_000_000L));

    mvc.perform(get("/api/v1/accounts/{account}", buyer))
        .andExpect(jsonPath("$.balance").value(904_000_000L));
    mvc.perform(get("/api/v1/passes/{target}", target))
        .andExpect(jsonPath("$.totalSupply").value(0))
        .andExpect(jsonPath("$.lastPrice").value(400_000_000L));
    mvc.perform(get("/api/v1/events").param("limit", "64"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.items[*].type", hasItem("PassSold")));
  }

  @Test
  void sellingWithoutSupplyIsConflict() throws Exception {
    mvc.perform(post("/api/v1/passes/{target}/sell", "0x1101")
            .header(Callers.HEADER, "0x1102")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"amount\":1}"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.reason").value("supply_underflow"))
        .andExpect(jsonPath("$.code").value("SUPPLY_UNDERFLOW"));
  }

  @Test
  void unfundedBuyerIsPaymentRequired() throws Exception {
    mvc.perform(post("/api/v1/passes/{target}/buy", "0x1201")
            .header(Callers.HEADER, "0x1202")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"amount\":1}"))
        .andExpect(status().isPaymentRequired())
        .andExpect(jsonPath("$.reason").value("insufficient_caller_balance"));
  }

  @Test
  void malformedRequestsAreBadRequest() throws Exception {
    mvc.perform(post("/api/v1/passes/{target}/buy", "0x1301")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"amount\":1}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.reason").value("bad_request"));

    mvc.perform(post("/api/v1/passes/{target}/buy", "0x1301")
            .header(Callers.HEADER, "0x1302")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"amount\":0}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.reason").value("validation_error"));

    mvc.perform(get("/api/v1/passes/{target}", "not-an-address"))
        .andExpect(status().isBadRequest());

    mvc.perform(get("/api/v1/passes/{target}/quote/buy", "0x1301").param("amount", "lots"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("malformed_request"));
  }

  @Test
  void vaultMirrorsSettlementAccount() throws Exception {
    faucet("0x1402", 1_000_000_000L);
    mvc.perform(post("/api/v1/passes/{target}/buy", "0x1401")
            .header(Callers.HEADER, "0x1402")
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"amount\":2}"))
        .andExpect(status().isOk());

    String body = mvc.perform(get("/api/v1/vault"))
        .andExpect(status().isOk())
        .andReturn().getResponse().getContentAsString();
    Number balance = JsonPath.read(body, "$.balance");
    Number settlement = JsonPath.read(body, "$.settlementBalance");
    assertThat(balance.longValue()).isEqualTo(settlement.longValue());
  }
}
