package com.zplat.ipld.remote;

import com.zplat.ipld.entity.VaultEntry;
import com.zplat.ipld.exception.AppException;
import com.zplat.ipld.exception.ErrorCode;
import com.zplat.ipld.repository.VaultRepository;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import lombok.experimental.NonFinal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Materializes a user's private key from the vault into {@code <key-dir>/<username>} with mode 600.
 * The file is rewritten only when missing or when its content differs from the vault.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
public class PrivateKeyResolver {

    VaultRepository vaultRepository;

    // 60 workers may resolve the same user at once
    ConcurrentMap<String, Object> userLocks = new ConcurrentHashMap<>();

    @NonFinal
    @Value("${ipld.vault.key-dir:keys}")
    String keyDir;

    public Path resolve(String username) {
        VaultEntry entry = vaultRepository.findFirstByUsernameOrderByIdAsc(username)
                .filter(v -> v.getPrivateKey() != null && !v.getPrivateKey().isBlank())
                .orElseThrow(() -> new AppException(ErrorCode.CREDENTIAL_NOT_FOUND, username));

        String key = normalize(entry.getPrivateKey());
        Path keyFile = Paths.get(keyDir).resolve(username);

        synchronized (userLocks.computeIfAbsent(username, u -> new Object())) {
            try {
                if (Files.exists(keyFile) && key.equals(Files.readString(keyFile, StandardCharsets.UTF_8))) {
                    return keyFile;
                }
                Files.createDirectories(keyFile.getParent());
                Files.writeString(keyFile, key, StandardCharsets.UTF_8);
                restrictPermissions(keyFile);
                log.info("Private key for {} written to {}", username, keyFile);
                return keyFile;
            } catch (IOException e) {
                throw new AppException(ErrorCode.PRIVATE_KEY_WRITE_ERROR, keyFile.toString(), e);
            }
        }
    }

    private String normalize(String raw) {
        String key = raw.replace("\r", "");
        return key.endsWith("\n") ? key : key + "\n";
    }

    private void restrictPermissions(Path keyFile) throws IOException {
        if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
            Files.setPosixFilePermissions(keyFile, PosixFilePermissions.fromString("rw-------"));
        } else {
            log.warn("Filesystem has no POSIX permissions, {} left with default mode", keyFile);
        }
    }
}
