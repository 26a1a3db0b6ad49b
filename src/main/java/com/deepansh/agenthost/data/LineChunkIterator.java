package com.deepansh.agenthost.data;

import com.deepansh.agenthost.exception.AgentException;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Emits a text one line at a time (terminator kept), then any trailing partial line.
 * Sleeps {@code delay} before every chunk but the first.
 */
final class LineChunkIterator implements Iterator<byte[]> {

    private final String text;
    private final Duration delay;
    private int position;
    private boolean first = true;

    LineChunkIterator(String text, Duration delay) {
        this.text = text;
        this.delay = delay;
    }

    @Override
    public boolean hasNext() {
        return position < text.length();
    }

    @Override
    public byte[] next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        if (!first) {
            pause();
        }
        first = false;
        int newline = text.indexOf('\n', position);
        int end = newline < 0 ? text.length() : newline + 1;
        String chunk = text.substring(position, end);
        position = end;
        return chunk.getBytes(StandardCharsets.UTF_8);
    }

    private void pause() {
        if (delay.isZero()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AgentException("stream read aborted", e);
        }
    }
}
