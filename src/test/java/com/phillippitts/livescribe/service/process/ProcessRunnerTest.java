package com.phillippitts.livescribe.service.process;

import com.phillippitts.livescribe.exception.RecognitionException;
import com.phillippitts.livescribe.testutil.ProcessTestDoubles.ProcessBehavior;
import com.phillippitts.livescribe.testutil.ProcessTestDoubles.StubProcessFactory;
import com.phillippitts.livescribe.testutil.ProcessTestDoubles.TestProcess;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProcessRunnerTest {

    private static final List<String> CMD = List.of("/opt/tool", "--flag");

    @Test
    void capturesStdoutOfSuccessfulRun() {
        TestProcess p = new TestProcess(ProcessBehavior.text("{\"text\":\"hi\"}\nsecond line", "warn", 0, 0));
        ProcessRunner runner = new ProcessRunner(new StubProcessFactory(p));

        ProcessOutput out = runner.run(CMD, null, Duration.ofSeconds(2), 1024, "whisper");

        assertThat(out.stdout()).isEqualTo("{\"text\":\"hi\"}\nsecond line");
        assertThat(out.stderr()).isEqualTo("warn");
        assertThat(out.exitCode()).isZero();
    }

    @Test
    void nonZeroExitIncludesStderrSnippet() {
        TestProcess p = new TestProcess(ProcessBehavior.text("", "model file corrupt", 3, 0));
        ProcessRunner runner = new ProcessRunner(new StubProcessFactory(p));

        assertThatThrownBy(() -> runner.run(CMD, null, Duration.ofSeconds(2), 1024, "whisper"))
                .isInstanceOf(RecognitionException.class)
                .hasMessageContaining("Non-zero exit: 3")
                .hasMessageContaining("stderr=model file corrupt")
                .hasMessageContaining("binary=/opt/tool")
                .satisfies(e -> assertThat(((RecognitionException) e).getEngineName()).isEqualTo("whisper"));
    }

    @Test
    void timeoutTerminatesProcess() {
        TestProcess p = new TestProcess(ProcessBehavior.text("", "", 0, -1));
        ProcessRunner runner = new ProcessRunner(new StubProcessFactory(p));

        assertThatThrownBy(() -> runner.run(CMD, null, Duration.ofMillis(100), 1024, "diarizer"))
                .isInstanceOf(RecognitionException.class)
                .hasMessageContaining("Timeout");
        assertThat(p.wasDestroyCalled()).isTrue();
        assertThat(p.isAlive()).isFalse();
    }

    @Test
    void launchFailureIsReportedAsIoFailure() {
        ProcessRunner runner = new ProcessRunner(StubProcessFactory.failing("No such file"));

        assertThatThrownBy(() -> runner.run(CMD, null, Duration.ofSeconds(1), 1024, "ffmpeg"))
                .isInstanceOf(RecognitionException.class)
                .hasMessageContaining("I/O failure: No such file");
    }

    @Test
    void stdoutPastCapFailsAndNamesTheCap() {
        String big = "a".repeat(50) + "\n" + "b".repeat(50);
        TestProcess p = new TestProcess(ProcessBehavior.text(big, "", 0, 0));
        ProcessRunner runner = new ProcessRunner(new StubProcessFactory(p));

        assertThatThrownBy(() -> runner.run(CMD, null, Duration.ofSeconds(2), 60, "whisper"))
                .isInstanceOf(RecognitionException.class)
                .hasMessageContaining("stdout exceeded 60 byte cap")
                .hasMessageContaining("exitCode=0");
    }

    @Test
    void stdoutFillingCapExactlyIsKept() {
        String exact = "a".repeat(30) + "\n" + "b".repeat(29);
        TestProcess p = new TestProcess(ProcessBehavior.text(exact, "", 0, 0));
        ProcessRunner runner = new ProcessRunner(new StubProcessFactory(p));

        ProcessOutput out = runner.run(CMD, null, Duration.ofSeconds(2), 60, "whisper");

        assertThat(out.stdout()).isEqualTo(exact);
    }

    @Test
    void rejectsEmptyCommand() {
        ProcessRunner runner = new ProcessRunner(StubProcessFactory.failing("unused"));
        assertThatThrownBy(() -> runner.run(List.of(), null, Duration.ofSeconds(1), 10, "x"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
