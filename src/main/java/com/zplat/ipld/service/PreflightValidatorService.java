package com.zplat.ipld.service;

import com.zplat.ipld.common.Constants;
import com.zplat.ipld.dto.response.DryRunStatusResponse;
import com.zplat.ipld.entity.enumeration.HostStatus;
import com.zplat.ipld.remote.RemoteExecutionChannel;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import lombok.experimental.NonFinal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Dry-run checks for one host: firewall, ssh login, dataset access, /tmp usage.
 * Each check moves from wait to done or error once and is published as soon as it settles.
 * A firewall failure stops the run before any remote call.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
public class PreflightValidatorService {

    NetworkPolicyService networkPolicyService;
    RemoteExecutionChannel channel;

    @NonFinal
    @Value("${ipld.preflight.tmp-space-threshold:60}")
    int tmpSpaceThreshold;

    public DryRunStatusResponse run(String hostname, String username, String dataset, ProgressEmitter emitter) {
        DryRunStatusResponse status = DryRunStatusResponse.builder()
                .firewallRules(HostStatus.WAIT.value())
                .checkSshLogin(HostStatus.WAIT.value())
                .checkDatasetAccess(HostStatus.WAIT.value())
                .checkTmpSpace(HostStatus.WAIT.value())
                .build();
        publish(status, emitter);

        // 1. firewall
        boolean firewallOk;
        try {
            firewallOk = networkPolicyService.hasEgressRule(hostname);
        } catch (RuntimeException e) {
            log.error("Firewall check failed for {}", hostname, e);
            firewallOk = false;
        }
        status.setFirewallRules(verdict(firewallOk));
        publish(status, emitter);
        if (!firewallOk) {
            log.warn("Dry run failed: firewall rule is missing for {}", hostname);
            failUnresolved(status);
            publish(status, emitter);
            return status;
        }

        try {
            // 2. ssh login
            String home = channel.runCommand(hostname, username, Constants.REMOTE.HOME_PWD);
            status.setCheckSshLogin(verdict(username.equals(lastPathSegment(home))));
            publish(status, emitter);

            // 3. dataset access
            String count = channel.runCommand(hostname, username,
                    String.format(Locale.ROOT, Constants.REMOTE.DATASET_COUNT, dataset));
            status.setCheckDatasetAccess(verdict(parseNumber(count, 0) > 1));
            publish(status, emitter);

            // 4. /tmp usage
            String usage = channel.runCommand(hostname, username, Constants.REMOTE.TMP_USAGE);
            status.setCheckTmpSpace(verdict(parseNumber(usage, 100) < tmpSpaceThreshold));
            publish(status, emitter);
        } catch (RuntimeException e) {
            log.error("An error occurred during dry run for {}", hostname, e);
            failUnresolved(status);
            publish(status, emitter);
        }
        return status;
    }

    static String lastPathSegment(String output) {
        if (output == null) return "";
        String[] lines = output.trim().split("\\R");
        String path = lines[lines.length - 1].trim();
        while (path.endsWith("/") && path.length() > 1) {
            path = path.substring(0, path.length() - 1);
        }
        int slash = path.lastIndexOf('/');
        return slash >= 0 ? path.substring(slash + 1) : path;
    }

    /** Last integer token of the output ("57%" reads as 57); {@code fallback} if there is none. */
    static int parseNumber(String output, int fallback) {
        if (output == null || output.isBlank()) return fallback;
        String[] tokens = output.trim().split("\\s+");
        String last = tokens[tokens.length - 1].replace("%", "");
        try {
            return Integer.parseInt(last);
        } catch (NumberFormatException e) {
            log.warn("Unexpected numeric output: {}", output);
            return fallback;
        }
    }

    private static String verdict(boolean ok) {
        return ok ? HostStatus.DONE.value() : HostStatus.ERROR.value();
    }

    private static void failUnresolved(DryRunStatusResponse status) {
        String wait = HostStatus.WAIT.value();
        String error = HostStatus.ERROR.value();
        if (wait.equals(status.getFirewallRules())) status.setFirewallRules(error);
        if (wait.equals(status.getCheckSshLogin())) status.setCheckSshLogin(error);
        if (wait.equals(status.getCheckDatasetAccess())) status.setCheckDatasetAccess(error);
        if (wait.equals(status.getCheckTmpSpace())) status.setCheckTmpSpace(error);
    }

    private static void publish(DryRunStatusResponse status, ProgressEmitter emitter) {
        emitter.emit(Constants.EVENT.DRY_RUN, new DryRunStatusResponse(
                status.getFirewallRules(),
                status.getCheckSshLogin(),
                status.getCheckDatasetAccess(),
                status.getCheckTmpSpace()));
    }
}
