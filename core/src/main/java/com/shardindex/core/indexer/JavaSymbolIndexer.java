package com.shardindex.core.indexer;

import com.shardindex.core.model.FileText;
import com.shardindex.core.model.Symbol;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Turns Java source text into symbols.
 */
public interface JavaSymbolIndexer {
    /**
     * Extracts the symbols declared in one file.
     *
     * @param path File path, recorded on every symbol
     * @param text Source text
     * @return Symbols in declaration order
     */
    List<Symbol> index(String path, String text);

    /**
     * Indexes every file of a shard.
     */
    default List<Symbol> indexFiles(Collection<FileText> files) {
        List<Symbol> symbols = new ArrayList<>();
        for (FileText file : files) {
            symbols.addAll(index(file.getPath(), file.getText()));
        }
        return symbols;
    }
}
