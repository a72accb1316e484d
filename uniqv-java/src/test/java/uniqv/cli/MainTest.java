package uniqv.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class MainTest {

    @TempDir
    Path dir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private int run(String... args) throws IOException {
        return Main.run(args,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private Path write(String name, String content) throws IOException {
        Path file = dir.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    @Test
    void wrong_argument_count_prints_usage() throws IOException {
        assertEquals(Main.USAGE, run());
        assertEquals(Main.USAGE, run("a", "b", "c"));
        assertTrue(err.toString(StandardCharsets.UTF_8).startsWith("Usage: uniqv"));
    }

    @Test
    void missing_input_file() throws IOException {
        assertEquals(Main.USAGE, run(dir.resolve("absent.uqv").toString()));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("No such file"));
    }

    @Test
    void renamed_program_goes_to_stdout() throws IOException {
        Path in = write("shadow.uqv", "fnc f : int(x: int) { let x = x + 1; return x; }");

        assertEquals(Main.OK, run(in.toString()));
        assertEquals("""
                fnc f : int(x: int) {
                    let __uqVar1__x__ = x + 1;
                    return __uqVar1__x__;
                }
                """, out.toString(StandardCharsets.UTF_8));
    }

    @Test
    void renamed_program_goes_to_the_output_file() throws IOException {
        Path in = write("in.uqv", "fnc g : void() { let a = 1; { let a = a; } }");
        Path target = dir.resolve("out.uqv");

        assertEquals(Main.OK, run(in.toString(), target.toString()));
        assertEquals(0, out.size());
        assertTrue(Files.readString(target).contains("let __uqVar1__a__ = a;"));
    }

    @Test
    void parse_error_is_reported_with_position() throws IOException {
        Path in = write("bad.uqv", "fnc f : void() { let x = 1 }");

        assertEquals(Main.FAILED, run(in.toString()));
        String msg = err.toString(StandardCharsets.UTF_8);
        assertTrue(msg.startsWith(in + ": [1:28]"), msg);
        assertEquals(0, out.size());
    }

    @Test
    void lexer_error_is_reported() throws IOException {
        Path in = write("bad.uqv", "fnc f : void() { let s = \"open; }");

        assertEquals(Main.FAILED, run(in.toString()));
        assertTrue(err.toString(StandardCharsets.UTF_8).startsWith(in + ": "));
    }

    @Test
    void oversized_int_literal_is_a_front_end_error() throws IOException {
        Path in = write("big.uqv", "fnc f : int() { let x = 2147483648; return x; }");

        assertEquals(Main.FAILED, run(in.toString()));
        String msg = err.toString(StandardCharsets.UTF_8);
        assertTrue(msg.contains("Integer literal out of range"), msg);
        assertEquals(0, out.size());
    }
}
