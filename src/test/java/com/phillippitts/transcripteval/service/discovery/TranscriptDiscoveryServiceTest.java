package com.phillippitts.transcripteval.service.discovery;

import com.phillippitts.transcripteval.domain.Transcript;
import com.phillippitts.transcripteval.exception.MissingReferenceException;
import com.phillippitts.transcripteval.exception.TranscriptDiscoveryException;
import com.phillippitts.transcripteval.service.performance.LatencyMetadataParser;
import com.phillippitts.transcripteval.service.performance.PerformanceMetadata;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TranscriptDiscoveryServiceTest {

    @TempDir
    Path texts;

    private TranscriptDiscoveryService discovery;

    @BeforeEach
    void setUp() {
        discovery = new TranscriptDiscoveryService("gt", "latency.json", new LatencyMetadataParser());
    }

    private void write(String relative, String content) throws IOException {
        Path file = texts.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
    }

    @Test
    void shouldLoadReferenceHypothesesAndLatency() throws IOException {
        write("gt/reference.txt", "  the weather is nice today\n");
        write("whisper.txt", "the weather nice today");
        write("vosk.txt", "the weather is nice to day");
        write("notes.md", "ignored");
        write("latency.json", "{\"whisper.txt\": {\"latency_ms\": 650, \"rtf\": 0.4}, \"vosk.txt\": 300}");

        DiscoveredTranscripts result = discovery.discover(texts);

        assertThat(result.groundTruth().text()).isEqualTo("the weather is nice today");
        assertThat(result.groundTruth().fileName()).isEqualTo("reference.txt");
        assertThat(result.hypotheses()).extracting(Transcript::name).containsExactly("vosk", "whisper");
        assertThat(result.hypotheses()).extracting(Transcript::fileName).containsExactly("vosk.txt", "whisper.txt");
        assertThat(result.latencyMap())
                .containsEntry("whisper.txt", new PerformanceMetadata.DetailedLatency(650.0, 0.4))
                .containsEntry("vosk.txt", new PerformanceMetadata.NumericLatency(300.0));
    }

    @Test
    void missingLatencyFileShouldYieldEmptyMapping() throws IOException {
        write("gt/reference.txt", "ref");
        write("a.txt", "hyp");

        assertThat(discovery.discover(texts).latencyMap()).isEmpty();
    }

    @Test
    void malformedLatencyFileShouldYieldEmptyMapping() throws IOException {
        write("gt/reference.txt", "ref");
        write("a.txt", "hyp");
        write("latency.json", "{not valid");

        assertThat(discovery.discover(texts).latencyMap()).isEmpty();
    }

    @Test
    void missingGroundTruthFolderShouldAbort() throws IOException {
        write("a.txt", "hyp");

        assertThatThrownBy(() -> discovery.discover(texts))
                .isInstanceOf(MissingReferenceException.class)
                .satisfies(e -> assertThat(((MissingReferenceException) e).getFoundCount()).isZero());
    }

    @Test
    void ambiguousGroundTruthShouldAbort() throws IOException {
        write("gt/one.txt", "ref");
        write("gt/two.txt", "ref");
        write("a.txt", "hyp");

        assertThatThrownBy(() -> discovery.discover(texts))
                .isInstanceOf(MissingReferenceException.class)
                .hasMessageContaining("found 2");
    }

    @Test
    void noHypothesesShouldAbort() throws IOException {
        write("gt/reference.txt", "ref");

        assertThatThrownBy(() -> discovery.discover(texts))
                .isInstanceOf(TranscriptDiscoveryException.class)
                .hasMessageContaining("No hypothesis transcripts");
    }

    @Test
    void missingTextsFolderShouldAbort() {
        Path missing = texts.resolve("does-not-exist");

        assertThatThrownBy(() -> discovery.discover(missing))
                .isInstanceOf(TranscriptDiscoveryException.class)
                .satisfies(e -> assertThat(((TranscriptDiscoveryException) e).getPath()).isEqualTo(missing.toString()));
    }

    @Test
    void invalidUtf8HypothesisShouldNotStopTheOthers() throws IOException {
        write("gt/ref.txt", "the weather is nice today");
        write("good.txt", "the weather is nice today");
        Files.write(texts.resolve("latin1.txt"), "café".getBytes(StandardCharsets.ISO_8859_1));

        DiscoveredTranscripts result = discovery.discover(texts);

        assertThat(result.hypotheses()).extracting(Transcript::name).containsExactly("good");
        assertThat(result.unreadable()).singleElement().satisfies(u -> {
            assertThat(u.name()).isEqualTo("latin1");
            assertThat(u.fileName()).isEqualTo("latin1.txt");
            assertThat(u.path()).isEqualTo(texts.resolve("latin1.txt").toString());
            assertThat(u.reason()).contains("MalformedInputException");
        });
    }

    @Test
    void folderWithOnlyUnreadableHypothesesShouldStillBeDiscovered() throws IOException {
        write("gt/ref.txt", "ref");
        Files.write(texts.resolve("latin1.txt"), "café".getBytes(StandardCharsets.ISO_8859_1));

        DiscoveredTranscripts result = discovery.discover(texts);

        assertThat(result.hypotheses()).isEmpty();
        assertThat(result.unreadable()).extracting(UnreadableTranscript::fileName).containsExactly("latin1.txt");
    }

    @Test
    void unreadableGroundTruthShouldAbort() throws IOException {
        Files.createDirectories(texts.resolve("gt"));
        Files.write(texts.resolve("gt/ref.txt"), "café".getBytes(StandardCharsets.ISO_8859_1));
        write("good.txt", "hyp");

        assertThatThrownBy(() -> discovery.discover(texts))
                .isInstanceOf(TranscriptDiscoveryException.class)
                .hasMessageContaining("Cannot read transcript");
    }
}
