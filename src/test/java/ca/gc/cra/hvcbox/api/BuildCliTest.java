package ca.gc.cra.hvcbox.api;

import static org.junit.jupiter.api.Assertions.*;

import ca.gc.cra.hvcbox.domain.hevc.Hvc1SampleEntry;
import ca.gc.cra.hvcbox.domain.io.BoxInput;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class BuildCliTest {
  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(BuildCli.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    if (logger != null && appender != null) {
      logger.detachAppender(appender);
    }
    CliPrinter.clearTestWriter();
  }

  @Test
  void buildsEntryFromYaml() throws Exception {
    Path config = Files.writeString(tempDir.resolve("track.yaml"),
        "width: 1920\nheight: 1080\nsps:\n  - \"" + "00".repeat(24) + "\"\npps:\n  - \"" + "11".repeat(6) + "\"\n");
    Path out = tempDir.resolve("track.hvc1");

    ExitCode code = BuildCli.run(new String[] {"config=" + config, "out=" + out});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("wrote 157 bytes to " + out));
    assertEquals(157, Files.size(out));
    try (BoxInput in = BoxInput.open(out)) {
      Hvc1SampleEntry entry = Hvc1SampleEntry.readBox(in);
      assertEquals(1920, entry.width());
      assertEquals(6, entry.hvcC().pictureParameterSets().get(0).length());
    }
  }

  @Test
  void missingArgumentsReturnInvalidArgs() {
    ExitCode code = BuildCli.run(new String[] {"config=x.yaml"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: build"));
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.ERROR
            && event.getFormattedMessage().contains("out=FILE")));
  }

  @Test
  void outputInMissingDirectoryIsRejected() throws Exception {
    Path config = Files.writeString(tempDir.resolve("track.yaml"), "width: 1\nheight: 1\n");

    ExitCode code = BuildCli.run(new String[] {
        "config=" + config, "out=" + tempDir.resolve("nope").resolve("track.hvc1")});

    assertEquals(ExitCode.INVALID_ARGS, code);
  }

  @Test
  void missingConfigReturnsConfigError() {
    ExitCode code = BuildCli.run(new String[] {
        "config=" + tempDir.resolve("absent.yaml"), "out=" + tempDir.resolve("track.hvc1")});

    assertEquals(ExitCode.CONFIG_ERROR, code);
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getFormattedMessage().contains("not found")));
  }

  @Test
  void invalidConfigReturnsConfigError() throws Exception {
    Path config = Files.writeString(tempDir.resolve("track.yaml"), "width: 1\nheight: 1\nsps:\n  - \"abc\"\n");

    ExitCode code = BuildCli.run(new String[] {"config=" + config, "out=" + tempDir.resolve("track.hvc1")});

    assertEquals(ExitCode.CONFIG_ERROR, code);
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.ERROR
            && event.getFormattedMessage().contains("Invalid build configuration")));
    assertFalse(Files.exists(tempDir.resolve("track.hvc1")));
  }
}
