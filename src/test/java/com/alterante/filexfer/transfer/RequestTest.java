package com.alterante.filexfer.transfer;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RequestTest {

    @Test
    void commandWordIsCaseInsensitive() throws Exception {
        assertEquals(CommandType.TIME, Request.parse("time").type());
        assertEquals(CommandType.LIST, Request.parse("  List ").type());
    }

    @Test
    void echoKeepsText() throws Exception {
        assertEquals("hello world", Request.parse("ECHO hello world").text());
        assertEquals("", Request.parse("ECHO").text());
    }

    @Test
    void uploadArguments() throws Exception {
        Request.Upload upload = Request.parse("upload a.bin 10").upload();
        assertEquals("a.bin", upload.name());
        assertEquals(10, upload.size());

        assertThrows(ProtocolException.class, () -> Request.parse("UPLOAD a.bin").upload());
        assertThrows(ProtocolException.class, () -> Request.parse("UPLOAD a.bin ten").upload());
        assertThrows(ProtocolException.class, () -> Request.parse("UPLOAD a.bin -1").upload());
    }

    @Test
    void downloadArgument() throws Exception {
        assertEquals("a.bin", Request.parse("DOWNLOAD a.bin").downloadName());
        assertThrows(ProtocolException.class, () -> Request.parse("DOWNLOAD").downloadName());
    }

    @Test
    void unknownAndEmptyRejected() {
        ProtocolException e = assertThrows(ProtocolException.class, () -> Request.parse("FETCH x"));
        assertEquals("unknown command FETCH", e.getMessage());
        assertThrows(ProtocolException.class, () -> Request.parse("   "));
    }

    @Test
    void offsetAndSizeLines() throws Exception {
        TransferProtocol.Offset offset = TransferProtocol.parseOffset("OFFSET 4 abc");
        assertEquals(4, offset.offset());
        assertEquals("abc", offset.checksum());
        assertEquals("0", TransferProtocol.parseOffset("OFFSET 0").checksum());
        assertEquals(10, TransferProtocol.parseSize("SIZE 10"));

        assertThrows(ProtocolException.class, () -> TransferProtocol.parseOffset("OK"));
        assertThrows(ProtocolException.class, () -> TransferProtocol.parseSize("SIZE"));
        assertEquals("ERROR: not found", TransferProtocol.error("not found"));
    }
}
