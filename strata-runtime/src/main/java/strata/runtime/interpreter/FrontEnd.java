package strata.runtime.interpreter;

import java.io.IOException;

/**
 * 交互式输入来源
 */
public interface FrontEnd {

    /**
     * 读取一行输入
     *
     * @param prompt 提示符
     * @return 读取到的文本，输入结束时返回 null
     */
    String readLine(String prompt) throws IOException;
}
