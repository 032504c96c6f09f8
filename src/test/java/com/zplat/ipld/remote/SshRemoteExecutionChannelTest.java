package com.zplat.ipld.remote;

import com.zplat.ipld.exception.ErrorCode;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class SshRemoteExecutionChannelTest {

    @Test
    void authFailuresAreRecognised() {
        assertThat(SshRemoteExecutionChannel.classify(255, "ibmuser@lpar1: Permission denied (publickey).", false))
                .isEqualTo(ErrorCode.SSH_AUTH_ERROR);
    }

    @Test
    void transportFailuresAreConnectionErrors() {
        assertThat(SshRemoteExecutionChannel.classify(255, "ssh: connect to host lpar1 port 22: Connection refused", false))
                .isEqualTo(ErrorCode.SSH_CONNECTION_ERROR);
        assertThat(SshRemoteExecutionChannel.classify(1, "lost connection", true))
                .isEqualTo(ErrorCode.SSH_CONNECTION_ERROR);
        assertThat(SshRemoteExecutionChannel.classify(255, "", false))
                .isEqualTo(ErrorCode.SSH_CONNECTION_ERROR);
    }

    @Test
    void remoteExitCodesAreCommandErrors() {
        assertThat(SshRemoteExecutionChannel.classify(2, "ls: /tmp/x: No such file or directory", false))
                .isEqualTo(ErrorCode.SSH_COMMAND_ERROR);
        assertThat(SshRemoteExecutionChannel.classify(1, "scp: /tmp/zplatipld/x/*.CSV: No such file or directory", true))
                .isEqualTo(ErrorCode.SSH_COMMAND_ERROR);
        assertThat(SshRemoteExecutionChannel.classify(255, null, true))
                .isEqualTo(ErrorCode.SSH_COMMAND_ERROR);
    }

    @Test
    void optionsDisableInteractivePrompts() {
        assertThat(SshRemoteExecutionChannel.commonOptions(Path.of("/keys/ibmuser")))
                .startsWith("-i", "/keys/ibmuser")
                .contains("BatchMode=yes", "StrictHostKeyChecking=no");
    }
}
