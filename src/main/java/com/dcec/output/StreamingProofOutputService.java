package com.dcec.output;

import com.dcec.reasoning.ProofAttempt;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.QuoteMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Streams every proof to {@value #JSON_FILE} (a JSON array of proof objects)
 * and a one-line summary to {@value #CSV_FILE}. Both files are rewritten on
 * {@link #initialize()}. Writes are serialized per file.
 */
public class StreamingProofOutputService implements ProofOutputService {

    private static final Logger LOGGER = LoggerFactory.getLogger(StreamingProofOutputService.class);

    public static final String JSON_FILE = "proofs.json";
    public static final String CSV_FILE = "proof_summary.csv";
    static final String[] CSV_HEADERS = {
            "Problem ID", "Goal", "Status", "Steps", "Time (ms)", "Strategy", "Cached", "Error"
    };

    private final String outputDirectory;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AtomicLong writtenCount = new AtomicLong(0);
    private final Object jsonLock = new Object();
    private final Object csvLock = new Object();

    private JsonGenerator jsonGenerator;
    private CSVPrinter csvPrinter;

    public StreamingProofOutputService(String outputDirectory) {
        this.outputDirectory = outputDirectory;
    }

    @Override
    public void initialize() throws IOException {
        LOGGER.info("Initializing StreamingProofOutputService with output directory: {}", outputDirectory);
        Path directory = Paths.get(outputDirectory);
        Files.createDirectories(directory);

        Path jsonFile = directory.resolve(JSON_FILE);
        jsonGenerator = objectMapper.getFactory()
                .createGenerator(Files.newBufferedWriter(jsonFile, StandardCharsets.UTF_8))
                .useDefaultPrettyPrinter();
        jsonGenerator.writeStartArray();

        Path csvFile = directory.resolve(CSV_FILE);
        Writer csvWriter = Files.newBufferedWriter(csvFile, StandardCharsets.UTF_8);
        csvPrinter = new CSVPrinter(csvWriter, CSVFormat.DEFAULT.builder()
                .setHeader(CSV_HEADERS)
                .setQuoteMode(QuoteMode.ALL)
                .build());

        LOGGER.info("Output files initialized: proofs={}, summary={}", jsonFile, csvFile);
    }

    @Override
    public void writeProof(String problemId, ProofAttempt attempt) {
        ObjectNode node = ProofFormatter.toJson(objectMapper, problemId, attempt);
        writeJson(problemId, node);
        writeCsv(problemId,
                attempt.getProofTree().getGoal().render(),
                attempt.getStatus().name(),
                attempt.getProofTree().getStepCount(),
                attempt.getElapsed().toMillis(),
                attempt.getStrategyName(),
                attempt.isFromCache(),
                attempt.getErrorMessage() == null ? "" : attempt.getErrorMessage());
        writtenCount.incrementAndGet();
    }

    @Override
    public void writeFailure(String problemId, String goalText, String errorMessage) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("problemId", problemId);
        node.put("goal", goalText);
        node.put("status", "FAILED");
        node.put("error", errorMessage);
        writeJson(problemId, node);
        writeCsv(problemId, goalText, "FAILED", 0, 0L, "", false, errorMessage);
        writtenCount.incrementAndGet();
    }

    private void writeJson(String problemId, ObjectNode node) {
        synchronized (jsonLock) {
            try {
                objectMapper.writeTree(jsonGenerator, node);
                jsonGenerator.flush();
            } catch (IOException e) {
                LOGGER.error("Error writing proof JSON for {}", problemId, e);
            }
        }
    }

    private void writeCsv(String problemId, Object... values) {
        synchronized (csvLock) {
            try {
                csvPrinter.print(problemId);
                for (Object value : values) {
                    csvPrinter.print(value);
                }
                csvPrinter.println();
                csvPrinter.flush();
            } catch (IOException e) {
                LOGGER.error("Error writing proof summary for {}", problemId, e);
            }
        }
    }

    @Override
    public long getWrittenCount() {
        return writtenCount.get();
    }

    @Override
    public void flush() {
        try {
            synchronized (jsonLock) {
                if (jsonGenerator != null) {
                    jsonGenerator.flush();
                }
            }
            synchronized (csvLock) {
                if (csvPrinter != null) {
                    csvPrinter.flush();
                }
            }
        } catch (IOException e) {
            LOGGER.error("Error flushing output", e);
        }
    }

    @Override
    public void close() throws IOException {
        LOGGER.info("Closing StreamingProofOutputService. Proofs written: {}", writtenCount.get());
        IOException failure = null;
        synchronized (jsonLock) {
            if (jsonGenerator != null) {
                try {
                    jsonGenerator.writeEndArray();
                    jsonGenerator.close();
                } catch (IOException e) {
                    LOGGER.error("Error closing proof JSON writer", e);
                    failure = e;
                } finally {
                    jsonGenerator = null;
                }
            }
        }
        synchronized (csvLock) {
            if (csvPrinter != null) {
                try {
                    csvPrinter.close(true);
                } catch (IOException e) {
                    LOGGER.error("Error closing proof summary writer", e);
                    if (failure == null) {
                        failure = e;
                    }
                } finally {
                    csvPrinter = null;
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }
}
