package com.iimsoft.bom.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.iimsoft.bom.api.dto.ExplodeRequest;
import com.iimsoft.bom.api.dto.ExplodeResponse;
import com.iimsoft.bom.service.BestellijstApiService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 统一入口：从 JSON 请求调用 BestellijstApiService。
 *
 * 用法：
 * - 读取文件：mvn exec:java -Dexec.args=path/to/request.json
 * - 读取 stdin：mvn exec:java -Dexec.args=- < request.json
 */
public class BestellijstServiceApp {

    private static final Logger LOGGER = LoggerFactory.getLogger(BestellijstServiceApp.class);

    public static void main(String[] args) throws Exception {
        if (args == null || args.length == 0 || args[0] == null || args[0].isBlank()) {
            System.err.println("Missing argument: ExplodeRequest JSON file, or '-' to read stdin.\n" +
                    "Example: mvn exec:java -Dexec.args=request.json");
            System.exit(2);
            return;
        }

        String input = args[0].trim();
        Path path = null;
        if (!"-".equals(input)) {
            path = Path.of(input);
            if (!Files.exists(path) || Files.isDirectory(path)) {
                System.err.println("Request file does not exist or is a directory: " + path.toAbsolutePath());
                System.exit(2);
                return;
            }
        }

        // 请求 JSON 解析失败和业务异常一样走统一错误出口
        try (InputStream in = path == null ? System.in : Files.newInputStream(path)) {
            System.out.println(run(in));
        } catch (IOException | IllegalArgumentException | IllegalStateException e) {
            LOGGER.error("Request failed", e);
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
        }
    }

    static String run(InputStream in) throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        ExplodeRequest request = mapper.readValue(in, ExplodeRequest.class);
        ExplodeResponse response = new BestellijstApiService().explode(request);
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(response);
    }
}
