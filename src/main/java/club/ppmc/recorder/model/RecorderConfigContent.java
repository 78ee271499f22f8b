/**
 * RecorderConfigContent.java
 *
 * 录制程序配置文件的读写载体，对应前端配置编辑页的数据结构。
 * main_config 为 config.ini 的 分节 -> 键值 映射，url_config 为 URL_config.ini 的纯文本内容。
 * 保存时任一部分为 null 表示不修改对应文件。
 */
package club.ppmc.recorder.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

public record RecorderConfigContent(
        @JsonProperty("main_config") Map<String, Map<String, String>> mainConfig,
        @JsonProperty("url_config") UrlConfig urlConfig) {

    public record UrlConfig(@JsonProperty("content") String content) {}
}
