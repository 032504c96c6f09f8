package com.zplat.ipld.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zplat.ipld.exception.AppException;
import com.zplat.ipld.exception.ErrorCode;
import com.zplat.ipld.webClient.CirrusApiClient;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import lombok.experimental.NonFinal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Service;

import java.net.InetAddress;
import java.net.UnknownHostException;

@Service
@RequiredArgsConstructor
@Slf4j
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
public class NetworkPolicyService {

    CirrusApiClient cirrusApiClient;
    ObjectMapper om = new ObjectMapper();

    @NonFinal
    @Value("${cirrus.api-version:v1}")
    String apiVersion;

    @NonFinal
    @Value("${cirrus.project-id}")
    String projectId;

    @NonFinal
    @Value("${cirrus.cluster-id}")
    String clusterId;

    /**
     * True if the cluster's egress policy lists the resolved address of {@code hostname}.
     *
     * @throws AppException NETWORK_POLICY_ERROR when the host cannot be resolved or the API call fails
     */
    public boolean hasEgressRule(String hostname) {
        String ip = resolve(hostname);
        String endpoint = "/" + apiVersion + "/" + projectId + "/" + clusterId;
        String body = cirrusApiClient.callApi(HttpMethod.GET, endpoint, null);

        try {
            JsonNode egress = om.readTree(body == null ? "{}" : body).path("egress");
            for (JsonNode rule : egress) {
                if (ip.equals(rule.path("destination_ip").asText())) {
                    log.info("Egress rule found for {} ({})", hostname, ip);
                    return true;
                }
            }
        } catch (com.fasterxml.jackson.core.JsonProcessingException e) {
            throw new AppException(ErrorCode.NETWORK_POLICY_ERROR, "unreadable policy for " + hostname, e);
        }
        log.warn("No egress rule for {} ({})", hostname, ip);
        return false;
    }

    String resolve(String hostname) {
        try {
            return InetAddress.getByName(hostname).getHostAddress();
        } catch (UnknownHostException e) {
            throw new AppException(ErrorCode.NETWORK_POLICY_ERROR, "cannot resolve " + hostname, e);
        }
    }
}
