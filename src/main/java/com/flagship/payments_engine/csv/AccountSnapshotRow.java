package com.flagship.payments_engine.csv;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.flagship.payments_engine.ledger.AccountSnapshot;
import lombok.Value;

import java.io.IOException;
import java.math.BigDecimal;

/**
 * Output row for one client account.
 * Column order and names define the output CSV header.
 */
@Value
@JsonPropertyOrder({"client", "available", "held", "total", "locked"})
public class AccountSnapshotRow {

    @JsonProperty("client")
    int clientId;

    @JsonSerialize(using = FourDecimalPlacesSerializer.class)
    BigDecimal available;

    @JsonSerialize(using = FourDecimalPlacesSerializer.class)
    BigDecimal held;

    @JsonSerialize(using = FourDecimalPlacesSerializer.class)
    BigDecimal total;

    boolean locked;

    public static AccountSnapshotRow fromSnapshot(AccountSnapshot snapshot) {
        return new AccountSnapshotRow(
            snapshot.getClientId(),
            snapshot.getAvailable(),
            snapshot.getHeld(),
            snapshot.getTotal(),
            snapshot.isLocked()
        );
    }

    public static class FourDecimalPlacesSerializer extends JsonSerializer<BigDecimal> {
        @Override
        public void serialize(BigDecimal value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
            gen.writeNumber(AmountFormatter.format(value));
        }
    }
}
