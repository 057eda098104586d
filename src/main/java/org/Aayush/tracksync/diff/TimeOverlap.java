package org.Aayush.tracksync.diff;

import lombok.experimental.UtilityClass;
import org.Aayush.tracksync.record.Record;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Finds records whose time spans overlap.
 */
@UtilityClass
public class TimeOverlap {

    /**
     * Groups of records where each record starts before its predecessor ends, sorted by
     * start time. Records without time are ignored.
     */
    public static List<List<Record>> groups(List<Record> records) {
        Objects.requireNonNull(records, "records");
        List<Record> timed = new ArrayList<>();
        for (Record record : records) {
            if (record.firstTime() != null && record.lastTime() != null) {
                timed.add(record);
            }
        }
        timed.sort(Comparator.comparing(Record::firstTime));

        List<List<Record>> result = new ArrayList<>();
        List<Record> group = new ArrayList<>();
        Record previous = null;
        for (Record current : timed) {
            if (previous != null && !current.firstTime().isAfter(previous.lastTime())) {
                if (group.isEmpty()) {
                    group.add(previous);
                }
                group.add(current);
            } else if (!group.isEmpty()) {
                result.add(group);
                group = new ArrayList<>();
            }
            previous = current;
        }
        if (!group.isEmpty()) {
            result.add(group);
        }
        return result;
    }
}
