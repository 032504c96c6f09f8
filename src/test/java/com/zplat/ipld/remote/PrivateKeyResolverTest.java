package com.zplat.ipld.remote;

import com.zplat.ipld.entity.VaultEntry;
import com.zplat.ipld.exception.AppException;
import com.zplat.ipld.exception.ErrorCode;
import com.zplat.ipld.repository.VaultRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assumptions.assumeThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class PrivateKeyResolverTest {

    @TempDir
    Path keyDir;

    VaultRepository vaultRepository;
    PrivateKeyResolver resolver;

    @BeforeEach
    void setUp() {
        vaultRepository = mock(VaultRepository.class);
        resolver = new PrivateKeyResolver(vaultRepository);
        ReflectionTestUtils.setField(resolver, "keyDir", keyDir.toString());
    }

    private void vaultHolds(String user, String key) {
        when(vaultRepository.findFirstByUsernameOrderByIdAsc(user))
                .thenReturn(Optional.of(VaultEntry.builder().id(1L).username(user).privateKey(key).build()));
    }

    @Test
    void writesKeyOnFirstUseWithOwnerOnlyMode() throws Exception {
        vaultHolds("ibmuser", "-----BEGIN KEY-----\r\nabc\r\n-----END KEY-----");

        Path file = resolver.resolve("ibmuser");

        assertThat(file).isEqualTo(keyDir.resolve("ibmuser"));
        assertThat(Files.readString(file)).isEqualTo("-----BEGIN KEY-----\nabc\n-----END KEY-----\n");
        assumeThat(FileSystems.getDefault().supportedFileAttributeViews()).contains("posix");
        assertThat(PosixFilePermissions.toString(Files.getPosixFilePermissions(file))).isEqualTo("rw-------");
    }

    @Test
    void rewritesStaleKey() throws Exception {
        Files.writeString(keyDir.resolve("ibmuser"), "old\n");
        vaultHolds("ibmuser", "new");

        Path file = resolver.resolve("ibmuser");

        assertThat(Files.readString(file)).isEqualTo("new\n");
    }

    @Test
    void missingOrBlankKeyIsCredentialNotFound() {
        when(vaultRepository.findFirstByUsernameOrderByIdAsc("ghost")).thenReturn(Optional.empty());
        vaultHolds("blank", "  ");

        assertThatThrownBy(() -> resolver.resolve("ghost"))
                .isInstanceOfSatisfying(AppException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo(ErrorCode.CREDENTIAL_NOT_FOUND));
        assertThatThrownBy(() -> resolver.resolve("blank"))
                .isInstanceOfSatisfying(AppException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo(ErrorCode.CREDENTIAL_NOT_FOUND));
    }
}
