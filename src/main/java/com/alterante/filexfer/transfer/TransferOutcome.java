package com.alterante.filexfer.transfer;

/**
 * How a client-side transfer ended.
 */
public enum TransferOutcome {
    COMPLETED,          // every byte is now on the receiving side
    ALREADY_COMPLETE,   // download: the local copy already had every byte, nothing moved
    REFUSED             // the server answered ERROR
}
