package com.strata.compiler.javac;

import javax.tools.SimpleJavaFileObject;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;

/**
 * 内存中的 class 文件：既作为 javac 的输出，也把会话中已编译的类作为输入暴露给 javac
 */
final class ByteClassFile extends SimpleJavaFileObject {

    private final String binaryName;
    private byte[] bytes;
    private ByteArrayOutputStream out;

    /** 输出 */
    ByteClassFile(String binaryName) {
        super(uriOf(binaryName), Kind.CLASS);
        this.binaryName = binaryName;
    }

    /** 输入 */
    ByteClassFile(String binaryName, byte[] bytes) {
        this(binaryName);
        this.bytes = bytes;
    }

    private static URI uriOf(String binaryName) {
        return URI.create("mem:///" + binaryName.replace('.', '/').replace(" ", "%20") + Kind.CLASS.extension);
    }

    String binaryName() {
        return binaryName;
    }

    byte[] bytes() {
        if (bytes == null && out != null) {
            bytes = out.toByteArray();
        }
        return bytes;
    }

    @Override
    public InputStream openInputStream() {
        return new ByteArrayInputStream(bytes());
    }

    @Override
    public OutputStream openOutputStream() {
        bytes = null;
        out = new ByteArrayOutputStream();
        return out;
    }
}
