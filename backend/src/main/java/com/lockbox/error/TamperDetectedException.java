package com.lockbox.error;

/**
 * The audit log hash chain does not verify.
 */
public class TamperDetectedException extends VaultException {

    private final long sequenceNumber;

    public TamperDetectedException(long sequenceNumber, String reason) {
        super("Audit chain broken at entry " + sequenceNumber + ": " + reason);
        this.sequenceNumber = sequenceNumber;
    }

    public long sequenceNumber() {
        return sequenceNumber;
    }

    @Override
    public String code() {
        return "TAMPER_DETECTED";
    }
}
