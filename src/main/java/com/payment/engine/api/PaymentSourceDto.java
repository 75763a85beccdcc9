package com.payment.engine.api;

import com.payment.engine.domain.CardSource;
import com.payment.engine.domain.PaymentSource;
import com.payment.engine.domain.TokenSource;
import com.payment.engine.exception.InvalidRequestException;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Payment source in a charge request: {@code creditcard} with card fields, or {@code token}.
 */
@Data
public class PaymentSourceDto {

    @NotBlank(message = "source.type is required")
    private String type;

    private String name;
    private String number;
    private String cvc;
    private Integer month;
    private Integer year;
    private Boolean threeDSecure;

    private String token;

    public PaymentSource toPaymentSource() {
        switch (type) {
            case CardSource.TYPE:
                if (isBlank(number) || isBlank(cvc) || month == null || year == null) {
                    throw new InvalidRequestException("Card number, cvc, month and year are required for creditcard sources");
                }
                return CardSource.builder()
                        .name(name)
                        .number(number)
                        .cvc(cvc)
                        .month(month)
                        .year(year)
                        .threeDSecure(threeDSecure)
                        .build();
            case TokenSource.TYPE:
                if (isBlank(token)) {
                    throw new InvalidRequestException("Token is required for token sources");
                }
                return new TokenSource(token);
            default:
                throw new InvalidRequestException("Unsupported source type: " + type);
        }
    }

    @Override
    public String toString() {
        return "PaymentSourceDto(type=" + type + ")";
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
