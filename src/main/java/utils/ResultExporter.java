package utils;

import checker.ValidityResult;
import com.alibaba.fastjson2.JSON;

import java.io.BufferedWriter;
import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Appends one JSON object per validity check to a JSON-lines file.
 */
public class ResultExporter implements AutoCloseable {

    private final File outputFile;
    private final BufferedWriter bufferedWriter;

    public ResultExporter(String outputPath) {
        this.outputFile = initOutputFile(outputPath);
        this.bufferedWriter = initBufferedWriter(this.outputFile);
    }

    private File initOutputFile(String outputPath) {
        File file = new File(outputPath);
        File parentDir = file.getParentFile();

        if (parentDir != null && !parentDir.exists()) {
            if (!parentDir.mkdirs()) {
                Log.error("Failed to create directory: " + parentDir.getAbsolutePath());
                throw new RuntimeException("Directory creation failed");
            }
        }
        return file;
    }

    private BufferedWriter initBufferedWriter(File file) {
        try {
            return new BufferedWriter(new FileWriter(file, StandardCharsets.UTF_8, true));
        } catch (IOException e) {
            Log.error("Failed to initialize BufferedWriter for file: " + file.getAbsolutePath() + " " + e);
            throw new RuntimeException("BufferedWriter initialization failed", e);
        }
    }

    public synchronized void writeResult(ValidityResult result) {
        try {
            bufferedWriter.write(JSON.toJSONString(result));
            bufferedWriter.newLine();
            bufferedWriter.flush();
        } catch (IOException e) {
            Log.error("Failed to write result to file: " + outputFile.getAbsolutePath() + " " + e);
        }
    }

    @Override
    public synchronized void close() {
        try {
            bufferedWriter.close();
        } catch (IOException e) {
            Log.error("Failed to close BufferedWriter: " + e.getMessage());
        }
    }
}
