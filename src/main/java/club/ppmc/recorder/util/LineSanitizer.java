/**
 * LineSanitizer.java
 *
 * 清除终端控制序列的工具类。
 * 录制程序自身的控制台日志会带有颜色、光标等 ANSI/VT 转义码，这些内容不应该转发给前端观察者。
 * 该类无状态，可在任意线程中使用。
 */
package club.ppmc.recorder.util;

import java.util.regex.Pattern;

public final class LineSanitizer {

    /**
     * 依次匹配：
     * 1. OSC 序列 (ESC ] ... 以 BEL 或 ESC \ 结尾)，例如设置窗口标题。
     * 2. CSI 序列 (ESC [ 或 8 位的 0x9B，参数字节、中间字节、终止字节)，颜色和光标控制都属于这一类。
     * 3. 其余两字节 ESC 序列及字符集选择 (例如 ESC ( B, ESC =)。
     * 4. 残留的单独 ESC / 0x9B，保证结果中不再包含任何转义起始字符，从而使清理操作幂等。
     */
    private static final Pattern ESCAPE_SEQUENCE = Pattern.compile(
            "\u001B\\][^\u0007\u001B]*(?:\u0007|\u001B\\\\)"
                    + "|(?:\u001B\\[|\u009B)[0-?]*[ -/]*[@-~]"
                    + "|\u001B[ -/]*[0-~]"
                    + "|[\u001B\u009B]");

    private LineSanitizer() {}

    /**
     * 移除文本中的所有终端转义序列，其余字符（包括内部空白）保持不变。
     *
     * @param text 原始文本，可以为 null。
     * @return 清理后的文本；输入为 null 时返回空字符串。
     */
    public static String sanitize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        if (text.indexOf('\u001B') < 0 && text.indexOf('\u009B') < 0) {
            return text;
        }
        return ESCAPE_SEQUENCE.matcher(text).replaceAll("");
    }
}
