package com.astro.calpipe.main;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.astro.calpipe.model.NightDirectory;
import com.astro.calpipe.support.FitsFixtures;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class CalPipeAppTest {

    @TempDir
    Path tmp;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();
    private Path configFile;

    @BeforeEach
    void setUp() throws Exception {
        configFile = tmp.resolve("calpipe.toml");
        Files.writeString(configFile, String.join("\n",
                "[paths]",
                "data_root = '" + tmp.resolve("nights") + "'",
                "pending_log = '" + tmp.resolve("pending.csv") + "'",
                "[matching]",
                "max_search_days = 3",
                ""));
    }

    private int execute(String... args) {
        CommandLine cmd = CalPipeApp.commandLine();
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
        return cmd.execute(args);
    }

    @Test
    void printsVersion() {
        assertEquals(0, execute("--version"));
        assertTrue(out.toString().startsWith("calpipe "), out.toString());
    }

    @Test
    void commandIsRequired() {
        assertEquals(2, execute());
        assertTrue(err.toString().contains("Missing command"), err.toString());
    }

    @Test
    void runsANight() throws Exception {
        NightDirectory night = FitsFixtures.night(tmp.resolve("nights"), "210310");
        FitsFixtures.raw(night, "bias0.fits").type("Bias Frame").exposure(0)
                .at(LocalDateTime.of(2021, 3, 10, 18, 0)).write();
        FitsFixtures.raw(night, "m42_001.fits").at(LocalDateTime.of(2021, 3, 10, 23, 0)).write();

        int code = execute("night", night.path().toString(), "-c", configFile.toString(),
                "--steps", "correction,reduction");

        assertEquals(0, code, out + "" + err);
        assertTrue(out.toString().contains("masters=1 reduced=1"), out.toString());
        assertTrue(Files.exists(night.reducedDir().resolve("m42_001.fits")));
        assertEquals(2, Files.readAllLines(tmp.resolve("pending.csv")).size());
    }

    @Test
    void unknownStepFailsBeforeRunning() throws Exception {
        NightDirectory night = FitsFixtures.night(tmp.resolve("nights"), "210310");

        int code = execute("night", night.path().toString(), "-c", configFile.toString(), "--steps", "stacking");

        assertEquals(1, code);
        assertTrue(err.toString().contains("stacking"), err.toString());
    }

    @Test
    void nightDirectoryMustBeNamedByDate() {
        assertEquals(1, execute("night", tmp.resolve("tonight").toString(), "-c", configFile.toString()));
    }

    @Test
    void pendingPassOnAnEmptyLedger() {
        assertEquals(0, execute("pending", "-c", configFile.toString(), "--today", "2021-03-12"));
        assertTrue(out.toString().contains("pending(logged=0 resolved=0 expired=0)"), out.toString());
    }

    @Test
    void rejectsMalformedToday() {
        assertEquals(2, execute("pending", "-c", configFile.toString(), "--today", "12/03/2021"));
        assertTrue(err.toString().contains("--today"), err.toString());
    }

    @Test
    void pendingNeedsALedgerLocation() throws Exception {
        Path bare = tmp.resolve("bare.toml");
        Files.writeString(bare, "[matching]\nmax_search_days = 3\n");

        assertEquals(2, execute("pending", "-c", bare.toString(), "--today", "2021-03-12"));
        assertTrue(err.toString().contains("--ledger"), err.toString());
        assertFalse(Files.exists(Path.of("pending_log.csv.lock")));

        Path ledgerFile = tmp.resolve("explicit.csv");
        assertEquals(0, execute("pending", "-c", bare.toString(), "--ledger", ledgerFile.toString(),
                "--today", "2021-03-12"));
    }
}
