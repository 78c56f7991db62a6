package com.lockbox.vault;

/**
 * Clear-text prefix of a vault file or export bundle.
 */
public record VaultHeader(int formatVersion, byte[] salt, int kdfIterations) {}
