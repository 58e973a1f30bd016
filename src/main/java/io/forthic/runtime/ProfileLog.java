package io.forthic.runtime;

import io.forthic.model.RuntimeValue;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class ProfileLog {
    private final Map<String, Integer> wordCounts = new LinkedHashMap<>();
    private final List<Timestamp> timestamps = new ArrayList<>();
    private boolean active;

    public void start() {
        active = true;
        wordCounts.clear();
        timestamps.clear();
    }

    public void stop() {
        active = false;
    }

    public boolean isActive() {
        return active;
    }

    public void countWord(String qualifiedName) {
        if (active) {
            wordCounts.merge(qualifiedName, 1, Integer::sum);
        }
    }

    public void addTimestamp(String label) {
        timestamps.add(new Timestamp(label, System.currentTimeMillis()));
    }

    public List<WordCount> wordHistogram() {
        List<WordCount> histogram = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : wordCounts.entrySet()) {
            histogram.add(new WordCount(entry.getKey(), entry.getValue()));
        }
        histogram.sort(Comparator.comparingInt(WordCount::count).reversed());
        return histogram;
    }

    public List<Timestamp> timestamps() {
        return List.copyOf(timestamps);
    }

    public RuntimeValue.RecordValue toRecord() {
        List<RuntimeValue> counts = new ArrayList<>();
        for (WordCount count : wordHistogram()) {
            Map<String, RuntimeValue> row = new LinkedHashMap<>();
            row.put("word", RuntimeValue.ofString(count.word()));
            row.put("count", RuntimeValue.ofInt(count.count()));
            counts.add(RuntimeValue.record(row));
        }
        List<RuntimeValue> stamps = new ArrayList<>();
        long previous = 0L;
        for (Timestamp timestamp : timestamps) {
            Map<String, RuntimeValue> row = new LinkedHashMap<>();
            row.put("label", RuntimeValue.ofString(timestamp.label()));
            row.put("time_ms", RuntimeValue.ofInt(timestamp.timeMs()));
            row.put("delta", RuntimeValue.ofInt(previous == 0L ? 0L : timestamp.timeMs() - previous));
            previous = timestamp.timeMs();
            stamps.add(RuntimeValue.record(row));
        }
        Map<String, RuntimeValue> data = new LinkedHashMap<>();
        data.put("word_counts", RuntimeValue.array(counts));
        data.put("timestamps", RuntimeValue.array(stamps));
        return RuntimeValue.record(data);
    }

    public record WordCount(String word, int count) {
    }

    public record Timestamp(String label, long timeMs) {
    }
}
