package minikv.commands;

import minikv.protocol.RespValue;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

public class CommandExtractorTest {

    @Test
    public void testBulkStringCommand() throws Exception {
        CommandLine line = CommandExtractor.toCommand(RespValue.array(
                RespValue.bulkString("SET"), RespValue.bulkString("k"), RespValue.bulkString("v")));
        assertEquals("SET", line.getName());
        assertEquals(Arrays.asList("k", "v"), line.getArgs());
    }

    @Test
    public void testSimpleStringElementsAreAccepted() throws Exception {
        CommandLine line = CommandExtractor.toCommand(RespValue.array(
                RespValue.simpleString("echo"), RespValue.bulkString("a"), RespValue.simpleString("b")));
        assertEquals("echo", line.getName());
        assertEquals(Arrays.asList("a", "b"), line.getArgs());
    }

    @Test
    public void testNameOnly() throws Exception {
        CommandLine line = CommandExtractor.toCommand(RespValue.array(RespValue.bulkString("PING")));
        assertEquals("PING", line.getName());
        assertEquals(Collections.emptyList(), line.getArgs());
    }

    @Test
    public void testRootMustBeArray() {
        assertThrows(CommandException.class, () -> CommandExtractor.toCommand(RespValue.simpleString("PING")));
        assertThrows(CommandException.class, () -> CommandExtractor.toCommand(RespValue.bulkString("PING")));
    }

    @Test
    public void testEmptyArray() {
        assertThrows(CommandException.class, () -> CommandExtractor.toCommand(RespValue.array()));
    }

    @Test
    public void testNestedArrayElement() {
        assertThrows(CommandException.class, () -> CommandExtractor.toCommand(RespValue.array(
                RespValue.bulkString("GET"), RespValue.array(RespValue.bulkString("k")))));
        assertThrows(CommandException.class, () -> CommandExtractor.toCommand(RespValue.array(
                RespValue.array(), RespValue.bulkString("k"))));
    }
}
