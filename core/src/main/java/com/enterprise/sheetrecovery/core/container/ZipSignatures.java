package com.enterprise.sheetrecovery.core.container;

/**
 * ZIP record markers, as Latin-1 strings so they can be searched in a losslessly decoded buffer.
 */
public final class ZipSignatures {

    public static final String LOCAL_FILE_HEADER = "PK\u0003\u0004";
    public static final String CENTRAL_DIRECTORY = "PK\u0001\u0002";
    public static final String DATA_DESCRIPTOR = "PK\u0007\u0008";
    public static final String END_OF_CENTRAL_DIRECTORY = "PK\u0005\u0006";

    static final String[] ALL = {LOCAL_FILE_HEADER, CENTRAL_DIRECTORY, DATA_DESCRIPTOR, END_OF_CENTRAL_DIRECTORY};

    /** Fixed part of a local file header, before the file name. */
    static final int LOCAL_HEADER_SIZE = 30;

    private ZipSignatures() {
    }

    /**
     * True when the buffer starts with "PK" followed by one of the archive record kinds
     * (0x03, 0x05, 0x07).
     */
    public static boolean startsWithZipSignature(byte[] bytes) {
        return bytes != null && bytes.length >= 4
                && bytes[0] == 'P' && bytes[1] == 'K'
                && (bytes[2] == 3 || bytes[2] == 5 || bytes[2] == 7);
    }

    static int u16le(byte[] bytes, int offset) {
        return (bytes[offset] & 0xFF) | (bytes[offset + 1] & 0xFF) << 8;
    }

    static long u32le(byte[] bytes, int offset) {
        return (long) u16le(bytes, offset) | (long) u16le(bytes, offset + 2) << 16;
    }
}
