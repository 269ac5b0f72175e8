package com.linlay.agentbus.stream.consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Drops text deltas that restate a tool result the model is echoing back.
 * Matching is prefix-based across deltas: partially matched text is withheld until
 * the head target is either fully consumed or the stream diverges from it.
 */
public class EchoSuppressor {

    private static final Logger log = LoggerFactory.getLogger(EchoSuppressor.class);

    private final Deque<String> targets = new ArrayDeque<>();
    private final StringBuilder withheld = new StringBuilder();
    private int matchedLength;

    public synchronized void expectEcho(String text) {
        if (text == null || text.isBlank()) {
            return;
        }
        targets.addLast(text);
    }

    public synchronized String filterDelta(String delta) {
        if (delta == null || delta.isEmpty()) {
            return "";
        }
        int position = 0;
        while (position < delta.length() && !targets.isEmpty()) {
            String target = targets.peekFirst();
            int length = Math.min(target.length() - matchedLength, delta.length() - position);
            if (!delta.regionMatches(position, target, matchedLength, length)) {
                String released = withheld + delta.substring(position);
                log.debug("Echo diverged after {} chars, releasing text and dropping {} targets", matchedLength, targets.size());
                clearTargets();
                return released;
            }
            withheld.append(delta, position, position + length);
            matchedLength += length;
            position += length;
            if (matchedLength == target.length()) {
                targets.pollFirst();
                withheld.setLength(0);
                matchedLength = 0;
            }
        }
        return delta.substring(position);
    }

    public synchronized boolean hasPendingTargets() {
        return !targets.isEmpty();
    }

    public synchronized void reset() {
        clearTargets();
    }

    private void clearTargets() {
        targets.clear();
        withheld.setLength(0);
        matchedLength = 0;
    }
}
