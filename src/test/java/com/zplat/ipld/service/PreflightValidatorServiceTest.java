package com.zplat.ipld.service;

import com.zplat.ipld.common.Constants;
import com.zplat.ipld.dto.response.DryRunStatusResponse;
import com.zplat.ipld.exception.ErrorCode;
import com.zplat.ipld.exception.RemoteExecutionException;
import com.zplat.ipld.remote.RemoteExecutionChannel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PreflightValidatorServiceTest {

    private static final String HOST = "lpar1.example.com";
    private static final String USER = "ibmuser";

    @Mock NetworkPolicyService networkPolicyService;
    @Mock RemoteExecutionChannel channel;
    @InjectMocks PreflightValidatorService validator;

    final List<DryRunStatusResponse> events = new ArrayList<>();
    final ProgressEmitter emitter = (event, payload) -> {
        assertThat(event).isEqualTo(Constants.EVENT.DRY_RUN);
        events.add((DryRunStatusResponse) payload);
    };

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(validator, "tmpSpaceThreshold", 60);
    }

    private static DryRunStatusResponse status(String fw, String ssh, String ds, String tmp) {
        return new DryRunStatusResponse(fw, ssh, ds, tmp);
    }

    @Test
    void missingFirewallRuleShortCircuits() {
        when(networkPolicyService.hasEgressRule(HOST)).thenReturn(false);

        DryRunStatusResponse result = validator.run(HOST, USER, "SYS1", emitter);

        verifyNoInteractions(channel);
        assertThat(events).containsExactly(
                status("wait", "wait", "wait", "wait"),
                status("error", "wait", "wait", "wait"),
                status("error", "error", "error", "error"));
        assertThat(events).noneMatch(e -> "done".equals(e.getCheckSshLogin())
                || "done".equals(e.getCheckDatasetAccess())
                || "done".equals(e.getCheckTmpSpace()));
        assertThat(result).isEqualTo(status("error", "error", "error", "error"));
    }

    @Test
    void firewallLookupFailureAlsoShortCircuits() {
        when(networkPolicyService.hasEgressRule(HOST)).thenThrow(new IllegalStateException("api down"));

        DryRunStatusResponse result = validator.run(HOST, USER, "SYS1", emitter);

        verifyNoInteractions(channel);
        assertThat(events.get(1)).isEqualTo(status("error", "wait", "wait", "wait"));
        assertThat(result).isEqualTo(status("error", "error", "error", "error"));
    }

    @Test
    void allChecksPassEmitsOneSnapshotPerCheck() {
        when(networkPolicyService.hasEgressRule(HOST)).thenReturn(true);
        when(channel.runCommand(HOST, USER, Constants.REMOTE.HOME_PWD)).thenReturn("/u/ibmuser");
        when(channel.runCommand(eq(HOST), eq(USER), contains("listcat level(SYS1)"))).thenReturn("1000");
        when(channel.runCommand(HOST, USER, Constants.REMOTE.TMP_USAGE)).thenReturn("35%");

        DryRunStatusResponse result = validator.run(HOST, USER, "SYS1", emitter);

        assertThat(events).containsExactly(
                status("wait", "wait", "wait", "wait"),
                status("done", "wait", "wait", "wait"),
                status("done", "done", "wait", "wait"),
                status("done", "done", "done", "wait"),
                status("done", "done", "done", "done"));
        assertThat(result).isEqualTo(status("done", "done", "done", "done"));
    }

    @Test
    void valueFailuresDoNotStopLaterChecks() {
        when(networkPolicyService.hasEgressRule(HOST)).thenReturn(true);
        when(channel.runCommand(HOST, USER, Constants.REMOTE.HOME_PWD)).thenReturn("/u/someoneelse");
        when(channel.runCommand(eq(HOST), eq(USER), startsWith("check="))).thenReturn("1");
        when(channel.runCommand(HOST, USER, Constants.REMOTE.TMP_USAGE)).thenReturn("60%");

        DryRunStatusResponse result = validator.run(HOST, USER, "SYS1", emitter);

        assertThat(result).isEqualTo(status("done", "error", "error", "error"));
        verify(channel, times(3)).runCommand(eq(HOST), eq(USER), anyString());
    }

    @Test
    void transportErrorMarksUnresolvedChecksError() {
        when(networkPolicyService.hasEgressRule(HOST)).thenReturn(true);
        when(channel.runCommand(HOST, USER, Constants.REMOTE.HOME_PWD)).thenReturn("/u/ibmuser/");
        when(channel.runCommand(eq(HOST), eq(USER), startsWith("check=")))
                .thenThrow(new RemoteExecutionException(ErrorCode.SSH_CONNECTION_ERROR, HOST, 255, "Connection closed"));

        DryRunStatusResponse result = validator.run(HOST, USER, "SYS1", emitter);

        assertThat(result).isEqualTo(status("done", "done", "error", "error"));
        assertThat(events.get(events.size() - 1)).isEqualTo(result);
        verify(channel, never()).runCommand(HOST, USER, Constants.REMOTE.TMP_USAGE);
    }

    @Test
    void parsesCommandOutput() {
        assertThat(PreflightValidatorService.lastPathSegment("motd line\n/u/ibmuser")).isEqualTo("ibmuser");
        assertThat(PreflightValidatorService.lastPathSegment("/home/ibmuser/")).isEqualTo("ibmuser");
        assertThat(PreflightValidatorService.parseNumber("  42 ", 0)).isEqualTo(42);
        assertThat(PreflightValidatorService.parseNumber("57%", 100)).isEqualTo(57);
        assertThat(PreflightValidatorService.parseNumber("IKJ56228I not found", 0)).isZero();
        assertThat(PreflightValidatorService.parseNumber(null, 100)).isEqualTo(100);
    }
}
