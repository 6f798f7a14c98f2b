package com.termindex.document;

import java.nio.file.Path;

/**
 * 语料读取失败，携带出错的文件路径。
 */
public class CorpusReadException extends RuntimeException {
    private final Path path;

    public CorpusReadException(String message, Path path, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
