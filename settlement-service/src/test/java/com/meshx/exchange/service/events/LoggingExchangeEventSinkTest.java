package com.meshx.exchange.service.events;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.meshx.exchange.events.CancelUpToEvent;
import com.meshx.exchange.events.FillEvent;
import com.meshx.exchange.events.OrderRejectedEvent;
import com.meshx.exchange.events.RejectReason;
import com.meshx.exchange.math.Uint256Math;
import com.meshx.exchange.order.OrderHash;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;
import org.web3j.abi.datatypes.Address;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;

@ExtendWith(OutputCaptureExtension.class)
class LoggingExchangeEventSinkTest {

  private static final Address MAKER = new Address("0x2c7536e3605d9c16a7a3d7b1898e529396a65c23");
  private static final Address TAKER = new Address("0x00000000000000000000000000000000000a11ce");
  private static final OrderHash HASH =
      OrderHash.parse("0xc5d2460186f7233c927e7db2dcc703c0e500b653ca82273b7bfad8045d85a470");

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final LoggingExchangeEventSink sink = new LoggingExchangeEventSink(objectMapper);

  @Test
  void rendersFillAsTypedJson() throws Exception {
    FillEvent fill = new FillEvent(HASH, MAKER, TAKER, new Address("0x0"), MAKER, TAKER,
        BigInteger.valueOf(100), BigInteger.valueOf(50), BigInteger.ZERO, BigInteger.ZERO);

    JsonNode json = objectMapper.readTree(sink.render(fill));

    assertThat(json.get("type").asText()).isEqualTo("Fill");
    JsonNode payload = json.get("payload");
    assertThat(payload.get("orderHash").asText()).isEqualTo(HASH.value());
    assertThat(payload.get("makerAddress").asText()).isEqualTo("0x2c7536e3605d9c16a7a3d7b1898e529396a65c23");
    assertThat(payload.get("makerAssetFilledAmount").asText()).isEqualTo("100");
  }

  @Test
  void largeAmountsStayExact() throws Exception {
    JsonNode json = objectMapper.readTree(sink.render(new CancelUpToEvent(MAKER, Uint256Math.MAX)));

    assertThat(json.get("type").asText()).isEqualTo("CancelUpTo");
    assertThat(new BigInteger(json.get("payload").get("makerEpoch").asText())).isEqualTo(Uint256Math.MAX);
  }

  @Test
  void rejectionUsesItsReasonAsType() throws Exception {
    OrderRejectedEvent rejected =
        new OrderRejectedEvent(RejectReason.ROUNDING_ERROR_TOO_LARGE, HASH, BigInteger.ONE, BigInteger.TEN);

    JsonNode json = objectMapper.readTree(sink.render(rejected));

    assertThat(json.get("type").asText()).isEqualTo("RoundingErrorTooLarge");
    assertThat(json.get("payload").get("remainingAmount").asText()).isEqualTo("10");
    sink.publish(rejected);
  }

  @Test
  void publishWritesTheRenderedLineVerbatim(CapturedOutput output) {
    CancelUpToEvent event = new CancelUpToEvent(MAKER, BigInteger.valueOf(12));

    sink.publish(event);

    assertThat(output.getOut()).contains(sink.render(event));
  }
}
