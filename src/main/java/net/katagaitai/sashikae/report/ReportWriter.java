package net.katagaitai.sashikae.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import net.katagaitai.sashikae.util.Constants;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

@Slf4j(topic = "sashikae")
public class ReportWriter {
    private final ObjectMapper mapper = new ObjectMapper();
    @Getter
    private final File directory;

    public ReportWriter() {
        this(new File(Constants.RESULT_DIRECTORY));
    }

    public ReportWriter(File directory) {
        this.directory = directory;
    }

    public String toJson(DiffReport report) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new ReportException("JSON変換失敗: " + report.getName(), e);
        }
    }

    public File save(DiffReport report) {
        String json = toJson(report);
        File file = getReportFile(report);
        if (!directory.exists()) {
            boolean success = directory.mkdirs();
            if (!success) {
                log.error("ディレクトリの作成失敗: {}", directory);
                throw new ReportException("ディレクトリの作成失敗: " + directory, null);
            }
        }
        try {
            Files.write(file.toPath(), json.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.error("", e);
            throw new ReportException("ファイルの書き込み失敗: " + file, e);
        }
        log.info("保存: {}", file);
        return file;
    }

    public File getReportFile(DiffReport report) {
        return new File(directory, String.format("%s.json", report.getName()));
    }
}
