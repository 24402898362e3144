package io.github.samzhu.keeper.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;

import com.fasterxml.jackson.databind.JsonNode;

import io.github.samzhu.keeper.config.KeeperProperties;
import io.github.samzhu.keeper.config.KeeperProperties.PaymentConfig;

/**
 * Stripe REST API 扣款實作。
 *
 * <p>流程：
 * <ol>
 *   <li>{@code GET /v1/customers/{id}} 取得預設付款方式</li>
 *   <li>{@code POST /v1/payment_intents} 以 {@code off_session=true, confirm=true} 建立並確認扣款</li>
 * </ol>
 *
 * <p>未設定 secret key 時直接回傳失敗，不呼叫 Stripe。
 *
 * @see <a href="https://docs.stripe.com/api/payment_intents/create">Stripe PaymentIntents API</a>
 * @see <a href="https://docs.stripe.com/api/idempotent_requests">Stripe Idempotent Requests</a>
 */
@Service
public class StripePaymentGateway implements PaymentGateway {

    private static final Logger log = LoggerFactory.getLogger(StripePaymentGateway.class);

    private final PaymentConfig config;
    private final RestClient restClient;

    public StripePaymentGateway(KeeperProperties properties, RestClient.Builder builder) {
        this.config = properties.payment();

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) config.timeout().toMillis());
        requestFactory.setReadTimeout((int) config.timeout().toMillis());

        RestClient.Builder configured = builder.clone()
            .baseUrl(config.apiBase())
            .requestFactory(requestFactory);
        if (config.isConfigured()) {
            configured.defaultHeader("Authorization", "Bearer " + config.secretKey());
        }
        this.restClient = configured.build();
    }

    @Override
    public ChargeResult charge(String customerRef, long amountCents, String idempotencyKey, String description) {
        if (!config.isConfigured()) {
            log.warn("Payment gateway not configured, skipping charge: customer={}", customerRef);
            return ChargeResult.failed("payment gateway not configured");
        }

        try {
            String paymentMethod = findDefaultPaymentMethod(customerRef);
            if (paymentMethod == null) {
                return ChargeResult.failed("no default payment method on file");
            }

            MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
            form.add("amount", String.valueOf(amountCents));
            form.add("currency", config.currency());
            form.add("customer", customerRef);
            form.add("payment_method", paymentMethod);
            form.add("off_session", "true");
            form.add("confirm", "true");
            form.add("description", description);

            JsonNode intent = restClient.post()
                .uri("/v1/payment_intents")
                .header("Idempotency-Key", idempotencyKey)
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(form)
                .retrieve()
                .body(JsonNode.class);

            if (intent == null) {
                return ChargeResult.failed("empty payment intent response");
            }
            String status = intent.path("status").asText();
            if (!"succeeded".equals(status)) {
                return ChargeResult.failed("payment intent status " + status);
            }
            return ChargeResult.succeeded(intent.path("id").asText());
        } catch (HttpClientErrorException e) {
            // 4xx (例如 card_declined) 屬於業務性失敗
            log.warn("Stripe rejected charge: customer={}, status={}, body={}",
                customerRef, e.getStatusCode(), e.getResponseBodyAsString());
            return ChargeResult.failed("stripe rejected charge: " + e.getStatusCode());
        }
    }

    private String findDefaultPaymentMethod(String customerRef) {
        JsonNode customer = restClient.get()
            .uri("/v1/customers/{id}", customerRef)
            .retrieve()
            .body(JsonNode.class);
        if (customer == null) {
            return null;
        }
        JsonNode method = customer.path("invoice_settings").path("default_payment_method");
        return method.isMissingNode() || method.isNull() ? null : method.asText();
    }
}
