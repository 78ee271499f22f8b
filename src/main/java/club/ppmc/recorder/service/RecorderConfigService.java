/**
 * RecorderConfigService.java
 *
 * 录制程序配置文件的读写服务。
 * config.ini 按 INI 格式解析为 分节 -> 键值 的映射，保存时保持键名大小写和给定的顺序；
 * URL_config.ini 是每行一个直播间地址的纯文本，原样读写。
 * 两个文件都以 UTF-8 读取，并兼容 Windows 记事本写入的 BOM 头。
 */
package club.ppmc.recorder.service;

import club.ppmc.recorder.model.RecorderConfigContent;
import club.ppmc.recorder.model.RecorderSettings;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.io.IOUtils;
import org.apache.commons.io.input.BOMInputStream;
import org.ini4j.Config;
import org.ini4j.Ini;
import org.ini4j.Profile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class RecorderConfigService {

    private static final Logger LOGGER = LoggerFactory.getLogger(RecorderConfigService.class);

    private final Path mainConfigPath;
    private final Path urlConfigPath;

    public RecorderConfigService(RecorderSettings settings) {
        this.mainConfigPath = settings.mainConfigPath();
        this.urlConfigPath = settings.urlConfigPath();
    }

    /**
     * 读取两个配置文件。文件不存在或无法解析时返回空内容，不抛出异常。
     */
    public RecorderConfigContent read() {
        return new RecorderConfigContent(
                readMainConfig(), new RecorderConfigContent.UrlConfig(readUrlConfig()));
    }

    /**
     * 保存配置。为 null 的部分不会被修改。
     *
     * @throws IOException 写入文件失败。
     */
    public synchronized void save(RecorderConfigContent content) throws IOException {
        if (content.mainConfig() != null) {
            saveMainConfig(content.mainConfig());
        }
        if (content.urlConfig() != null) {
            saveUrlConfig(content.urlConfig().content());
        }
    }

    private Map<String, Map<String, String>> readMainConfig() {
        Map<String, Map<String, String>> result = new LinkedHashMap<>();
        if (Files.notExists(mainConfigPath)) {
            return result;
        }
        try (Reader reader = new InputStreamReader(openWithoutBom(mainConfigPath), StandardCharsets.UTF_8)) {
            Ini ini = newIni();
            ini.load(reader);
            for (Profile.Section section : ini.values()) {
                Map<String, String> values = new LinkedHashMap<>();
                for (String key : section.keySet()) {
                    values.put(key, section.get(key));
                }
                result.put(section.getName(), values);
            }
        } catch (IOException e) {
            LOGGER.error("读取配置文件 {} 失败", mainConfigPath, e);
            result.clear();
        }
        return result;
    }

    private String readUrlConfig() {
        if (Files.notExists(urlConfigPath)) {
            return "";
        }
        try (InputStream in = openWithoutBom(urlConfigPath)) {
            return IOUtils.toString(in, StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOGGER.error("读取 URL 配置文件 {} 失败", urlConfigPath, e);
            return "";
        }
    }

    private void saveMainConfig(Map<String, Map<String, String>> mainConfig) throws IOException {
        Ini ini = newIni();
        mainConfig.forEach((sectionName, values) -> {
            Profile.Section section = ini.add(sectionName);
            if (values != null) {
                values.forEach((key, value) -> section.put(key, value == null ? "" : value));
            }
        });
        ensureParentExists(mainConfigPath);
        try (Writer writer = Files.newBufferedWriter(mainConfigPath, StandardCharsets.UTF_8)) {
            ini.store(writer);
        } catch (IOException e) {
            LOGGER.error("将配置保存到文件 {} 时失败", mainConfigPath, e);
            throw e;
        }
        LOGGER.info("已将配置保存到 {}", mainConfigPath);
    }

    private void saveUrlConfig(String content) throws IOException {
        ensureParentExists(urlConfigPath);
        try {
            Files.writeString(urlConfigPath, content == null ? "" : content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOGGER.error("将 URL 配置保存到文件 {} 时失败", urlConfigPath, e);
            throw e;
        }
        LOGGER.info("已将 URL 配置保存到 {}", urlConfigPath);
    }

    private static Ini newIni() {
        Config config = new Config();
        config.setEscape(false);
        config.setEmptyOption(true);
        config.setMultiOption(false);
        Ini ini = new Ini();
        ini.setConfig(config);
        return ini;
    }

    private static InputStream openWithoutBom(Path path) throws IOException {
        return BOMInputStream.builder().setInputStream(Files.newInputStream(path)).get();
    }

    private static void ensureParentExists(Path path) throws IOException {
        Path parent = path.getParent();
        if (parent != null && Files.notExists(parent)) {
            Files.createDirectories(parent);
        }
    }
}
