package com.zplat.ipld.remote;

import java.nio.file.Path;

/**
 * One-shot access to a remote host. Every call opens its own session and closes it before
 * returning; nothing is pooled between calls.
 *
 * <p>Failures surface as {@link com.zplat.ipld.exception.RemoteExecutionException} with error
 * code {@code SSH_CONNECTION_ERROR}, {@code SSH_AUTH_ERROR} or {@code SSH_COMMAND_ERROR}, or as
 * {@link com.zplat.ipld.exception.AppException} with {@code CREDENTIAL_NOT_FOUND} when the vault
 * holds no key for the user.</p>
 */
public interface RemoteExecutionChannel {

    /** Runs {@code command} through the remote login shell and returns its trimmed stdout. */
    String runCommand(String host, String user, String command);

    /** Copies a local file into {@code remoteDir}. */
    void uploadFile(String host, String user, Path localFile, String remoteDir);

    /** Copies the remote path (globs allowed) into the local directory. */
    void downloadFile(String host, String user, String remotePath, Path localDir);
}
