package com.example.tftlobby.fetch;

import java.util.ArrayList;
import java.util.List;

public class RecordingSleeper implements Sleeper {

    public final List<Long> sleeps = new ArrayList<>();

    @Override
    public synchronized void sleep(long millis) {
        sleeps.add(millis);
    }

    public long total() {
        long sum = 0;
        for (Long s : sleeps) sum += s;
        return sum;
    }
}
