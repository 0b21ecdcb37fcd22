package com.strata.compiler.javac;

import javax.tools.SimpleJavaFileObject;
import java.net.URI;

/**
 * 内存中的编译单元
 */
final class StringSource extends SimpleJavaFileObject {

    private final String code;
    private final String fileName;

    StringSource(String fileName, String code) {
        super(URI.create("string:///" + fileName), Kind.SOURCE);
        this.fileName = fileName;
        this.code = code;
    }

    @Override
    public CharSequence getCharContent(boolean ignoreEncodingErrors) {
        return code;
    }

    @Override
    public String getName() {
        return fileName;
    }
}
