package com.mainframe.contract.service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.HashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.contract.model.ContractSpec;

import lombok.Value;

/**
 * Contracts already extracted in this process, keyed by source path and extraction profile.
 * An entry is rebuilt when the source file's modification time changes.
 */
public class ContractCache {

    private static final Logger log = LoggerFactory.getLogger(ContractCache.class);

    private final Map<Key, Entry> entries = new HashMap<>();

    @FunctionalInterface
    public interface ContractLoader {
        ContractSpec load() throws IOException;
    }

    public synchronized ContractSpec getOrLoad(Path source, String profileKey, ContractLoader loader) throws IOException {
        Key key = new Key(source.toAbsolutePath().normalize(), profileKey);
        FileTime modified = Files.getLastModifiedTime(source);
        Entry entry = entries.get(key);
        if (entry != null && entry.getModified().equals(modified)) {
            log.debug("Contract cache hit for {}", source);
            return entry.getContract();
        }
        ContractSpec contract = loader.load();
        entries.put(key, new Entry(modified, contract));
        return contract;
    }

    public synchronized void invalidate(Path source) {
        Path normalized = source.toAbsolutePath().normalize();
        entries.keySet().removeIf(k -> k.getSource().equals(normalized));
    }

    public synchronized int size() {
        return entries.size();
    }

    @Value
    private static class Key {
        Path source;
        String profile;
    }

    @Value
    private static class Entry {
        FileTime modified;
        ContractSpec contract;
    }
}
