package com.zplat.ipld.remote;

import com.zplat.ipld.exception.ErrorCode;
import com.zplat.ipld.exception.RemoteExecutionException;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import lombok.experimental.NonFinal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * {@link RemoteExecutionChannel} backed by the local OpenSSH client ({@code ssh} / {@code scp}).
 * Each call is one short-lived process, so sessions never outlive the call.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
public class SshRemoteExecutionChannel implements RemoteExecutionChannel {

    static final int SSH_TRANSPORT_EXIT = 255;

    PrivateKeyResolver keyResolver;

    @NonFinal
    @Value("${ipld.ssh.port:22}")
    int port;

    @NonFinal
    @Value("${ipld.ssh.command-timeout-minutes:30}")
    long timeoutMinutes;

    @Override
    public String runCommand(String host, String user, String command) {
        Path key = keyResolver.resolve(user);
        List<String> args = new ArrayList<>();
        args.add("ssh");
        args.addAll(commonOptions(key));
        args.add("-p");
        args.add(String.valueOf(port));
        args.add(user + "@" + host);
        args.add(command);
        return execute(host, args, false);
    }

    @Override
    public void uploadFile(String host, String user, Path localFile, String remoteDir) {
        Path key = keyResolver.resolve(user);
        List<String> args = scpArgs(key);
        args.add(localFile.toAbsolutePath().toString());
        args.add(user + "@" + host + ":" + remoteDir);
        execute(host, args, true);
    }

    @Override
    public void downloadFile(String host, String user, String remotePath, Path localDir) {
        Path key = keyResolver.resolve(user);
        List<String> args = scpArgs(key);
        args.add(user + "@" + host + ":" + remotePath);
        args.add(localDir.toAbsolutePath().toString());
        execute(host, args, true);
    }

    private List<String> scpArgs(Path key) {
        List<String> args = new ArrayList<>();
        args.add("scp");
        args.addAll(commonOptions(key));
        args.add("-P");
        args.add(String.valueOf(port));
        return args;
    }

    static List<String> commonOptions(Path key) {
        return List.of(
                "-i", key.toAbsolutePath().toString(),
                "-o", "StrictHostKeyChecking=no",
                "-o", "UserKnownHostsFile=/dev/null",
                "-o", "BatchMode=yes",
                "-o", "LogLevel=ERROR"
        );
    }

    /** stdout/stderr go to temp files so a chatty remote never blocks on a full pipe. */
    private String execute(String host, List<String> args, boolean scp) {
        Path out = null;
        Path err = null;
        try {
            out = Files.createTempFile("ipld-ssh-", ".out");
            err = Files.createTempFile("ipld-ssh-", ".err");
            ProcessBuilder pb = new ProcessBuilder(args)
                    .redirectOutput(out.toFile())
                    .redirectError(err.toFile());
            Process p = pb.start();

            boolean finished = p.waitFor(timeoutMinutes, TimeUnit.MINUTES);
            if (!finished) {
                p.destroyForcibly();
                throw new RemoteExecutionException(ErrorCode.SSH_CONNECTION_ERROR, host, -1,
                        "no answer after " + timeoutMinutes + " minutes");
            }

            int exit = p.exitValue();
            String stdout = Files.readString(out, StandardCharsets.UTF_8).trim();
            if (exit != 0) {
                String stderr = Files.readString(err, StandardCharsets.UTF_8).trim();
                log.debug("[{}] {} exit={} stderr={}", host, args.get(0), exit, stderr);
                throw new RemoteExecutionException(classify(exit, stderr, scp), host, exit, stderr);
            }
            return stdout;
        } catch (IOException e) {
            throw new RemoteExecutionException(ErrorCode.SSH_CONNECTION_ERROR, host, "cannot start " + args.get(0), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteExecutionException(ErrorCode.SSH_CONNECTION_ERROR, host, "interrupted", e);
        } finally {
            deleteQuietly(out);
            deleteQuietly(err);
        }
    }

    static ErrorCode classify(int exit, String stderr, boolean scp) {
        String msg = stderr == null ? "" : stderr;
        if (msg.contains("Permission denied (publickey") || msg.contains("Too many authentication failures")) {
            return ErrorCode.SSH_AUTH_ERROR;
        }
        if (msg.contains("Connection refused") || msg.contains("Connection timed out")
                || msg.contains("Could not resolve hostname") || msg.contains("No route to host")
                || msg.contains("Connection closed") || msg.contains("lost connection")) {
            return ErrorCode.SSH_CONNECTION_ERROR;
        }
        // ssh reports its own failures as 255; anything else is the remote command's exit code
        if (!scp && exit == SSH_TRANSPORT_EXIT) {
            return ErrorCode.SSH_CONNECTION_ERROR;
        }
        return ErrorCode.SSH_COMMAND_ERROR;
    }

    private void deleteQuietly(Path p) {
        if (p == null) return;
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            log.warn("Failed to delete temp file {}: {}", p, e.getMessage());
        }
    }
}
