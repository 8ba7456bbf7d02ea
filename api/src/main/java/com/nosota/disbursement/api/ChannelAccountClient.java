package com.nosota.disbursement.api;

import com.nosota.disbursement.api.dto.ChannelAccountDTO;
import com.nosota.disbursement.api.request.CreateChannelAccountsRequest;
import com.nosota.disbursement.api.request.EnsureChannelAccountsRequest;
import com.nosota.disbursement.api.response.ChannelAccountPoolResponse;
import com.nosota.disbursement.api.response.ChannelAccountVerificationResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;

/**
 * WebClient-based implementation of ChannelAccountApi for operator tooling.
 *
 * <p><b>IMPORTANT:</b> This client is NOT a Spring @Component. Consumers register it as a bean:
 * <pre>
 * {@code
 * @Bean
 * public ChannelAccountClient channelAccountClient(WebClient.Builder builder,
 *                                                  @Value("${services.disbursement.url}") String baseUrl) {
 *     return new ChannelAccountClient(builder.baseUrl(baseUrl).build());
 * }
 * }
 * </pre>
 */
@RequiredArgsConstructor
@Slf4j
public class ChannelAccountClient implements ChannelAccountApi {

    private static final String BASE_PATH = "/api/v1/channel-accounts";

    private final WebClient webClient;

    @Override
    public ResponseEntity<List<ChannelAccountDTO>> viewChannelAccounts() {
        log.debug("Calling viewChannelAccounts");

        return webClient.get()
                .uri(BASE_PATH)
                .retrieve()
                .toEntity(new ParameterizedTypeReference<List<ChannelAccountDTO>>() {})
                .block();
    }

    @Override
    public ResponseEntity<ChannelAccountPoolResponse> createChannelAccounts(CreateChannelAccountsRequest request) {
        log.debug("Calling createChannelAccounts: count={}", request.count());

        return webClient.post()
                .uri(BASE_PATH)
                .bodyValue(request)
                .retrieve()
                .toEntity(ChannelAccountPoolResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<ChannelAccountPoolResponse> ensureChannelAccountsCount(EnsureChannelAccountsRequest request) {
        log.debug("Calling ensureChannelAccountsCount: count={}", request.count());

        return webClient.put()
                .uri(BASE_PATH + "/count")
                .bodyValue(request)
                .retrieve()
                .toEntity(ChannelAccountPoolResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<Void> deleteChannelAccount(String publicKey) {
        log.debug("Calling deleteChannelAccount: publicKey={}", publicKey);

        return webClient.delete()
                .uri(BASE_PATH + "/{publicKey}", publicKey)
                .retrieve()
                .toBodilessEntity()
                .block();
    }

    @Override
    public ResponseEntity<ChannelAccountPoolResponse> deleteAllChannelAccounts() {
        log.debug("Calling deleteAllChannelAccounts");

        return webClient.delete()
                .uri(BASE_PATH)
                .retrieve()
                .toEntity(ChannelAccountPoolResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<ChannelAccountVerificationResponse> verifyChannelAccounts(boolean pruneInvalid) {
        log.debug("Calling verifyChannelAccounts: pruneInvalid={}", pruneInvalid);

        return webClient.post()
                .uri(uriBuilder -> uriBuilder
                        .path(BASE_PATH + "/verify")
                        .queryParam("pruneInvalid", pruneInvalid)
                        .build())
                .retrieve()
                .toEntity(ChannelAccountVerificationResponse.class)
                .block();
    }
}
