package com.questrail.wavemeter.command;

import com.questrail.wavemeter.api.ChannelId;
import com.questrail.wavemeter.api.Quantity;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CommandCodecTest {

    private final CommandCodec codec = new CommandCodec();

    @Test
    void decodesProgramValueWithWait() throws Exception {
        CommandRequest r = codec.decode(
                "{\"action\":\"PROGRAM_VALUE\",\"connection\":3,\"quantity\":\"Setpoint\",\"value\":348.66641,\"wait\":true}");

        assertEquals(CommandAction.PROGRAM_VALUE, r.action());
        assertEquals(ChannelId.of(3), r.channel());
        assertEquals(Quantity.SETPOINT, r.quantity());
        assertEquals(348.66641, r.value());
        assertTrue(r.waitForConvergence());
    }

    @Test
    void quantityDefaultsToSetpointAndWaitToFalse() throws Exception {
        CommandRequest r = codec.decode("{\"action\":\"CHECK_VALUE\",\"connection\":\"2\"}");

        assertEquals(Quantity.SETPOINT, r.quantity());
        assertEquals(ChannelId.of(2), r.channel());
        assertFalse(r.waitForConvergence());
        assertNull(r.value());
    }

    @Test
    void acceptsConstantNamesAndCommaDecimals() throws Exception {
        CommandRequest r = codec.decode(
                "{\"action\":\"PROGRAM_VALUE\",\"connection\":1,\"quantity\":\"PID_P\",\"value\":\"0,125\"}");

        assertEquals(Quantity.PID_P, r.quantity());
        assertEquals(0.125, r.value());
    }

    @Test
    void rejectsMalformedRequests() {
        assertThrows(CommandFormatException.class, () -> codec.decode("{"));
        assertThrows(CommandFormatException.class, () -> codec.decode("[1,2]"));
        assertThrows(CommandFormatException.class, () -> codec.decode("{\"connection\":1}"));
        assertThrows(CommandFormatException.class, () -> codec.decode("{\"action\":\"CHECK_VALUE\",\"quantity\":\"Colour\"}"));
        assertThrows(CommandFormatException.class, () -> codec.decode("{\"action\":\"CHECK_VALUE\",\"connection\":1.5}"));
        assertThrows(CommandFormatException.class, () -> codec.decode("{\"action\":\"PROGRAM_VALUE\",\"connection\":1,\"value\":\"abc\"}"));
    }

    @Test
    void unknownChannelNumberIsReported() {
        CommandFormatException e = assertThrows(CommandFormatException.class,
                () -> codec.decode("{\"action\":\"CHECK_VALUE\",\"connection\":9}"));
        assertEquals("Unknown channel: 9", e.getMessage());
    }

    @Test
    void helloIgnoresConnectionAndOtherFields() throws Exception {
        assertEquals(CommandRequest.hello(), codec.decode("{\"action\":\"HELLO\",\"connection\":9}"));
        assertEquals(CommandRequest.hello(),
                codec.decode("{\"action\":\"HELLO\",\"connection\":\"x\",\"quantity\":\"Nope\"}"));
    }

    @Test
    void encodesOnlyPresentFields() {
        assertEquals("{\"status\":\"SUCCESS\",\"value\":350.5}", codec.encode(CommandResponse.value(350.5)));
        assertEquals("{\"status\":\"TIMEOUT\",\"message\":\"slow\"}", codec.encode(CommandResponse.timeout("slow")));
        assertEquals("{\"status\":\"SUCCESS\",\"result\":\"CONVERGED\",\"value\":348.66641}",
                codec.encode(CommandResponse.converged(348.66641)));
        assertEquals("{\"status\":\"SUCCESS\",\"result\":\"APPLIED\",\"value\":350.25}",
                codec.encode(CommandResponse.applied(350.25)));
    }
}
