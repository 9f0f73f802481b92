package me.golemcore.engine.domain.system.act;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.engine.domain.model.MessageCategory;
import me.golemcore.engine.infrastructure.config.EngineProperties;

import java.util.Arrays;
import java.util.Random;
import java.util.function.Consumer;

/**
 * Presentation-only pacing for communication-channel output. Speech is streamed
 * character by character, messenger text line by line with a delay that grows
 * with line length. Concatenating the emitted pieces always reproduces the
 * (newline-normalized) input.
 */
@Slf4j
public class PacingStreamer {

    private final EngineProperties.StreamingProperties settings;
    private final Sleeper sleeper;
    private final Random random;

    public PacingStreamer(EngineProperties.StreamingProperties settings, Sleeper sleeper, Random random) {
        this.settings = settings;
        this.sleeper = sleeper;
        this.random = random;
    }

    /**
     * Streams {@code text} in the mode matching {@code category}. Categories
     * without a pacing mode get the whole text as one piece.
     */
    public void stream(String text, MessageCategory category, Consumer<String> onChunk) {
        if (text == null || text.isEmpty()) {
            return;
        }
        if (!settings.isPacingEnabled()) {
            onChunk.accept(text);
            return;
        }
        if (category == MessageCategory.SPEAK_IN_PERSON) {
            typewriter(text, onChunk);
        } else if (category == MessageCategory.TELEGRAM) {
            lineByLine(text, onChunk);
        } else {
            onChunk.accept(text);
        }
    }

    void typewriter(String text, Consumer<String> onChunk) {
        long delay = settings.getTypewriterCharDelayMs();
        int offset = 0;
        while (offset < text.length()) {
            int next = text.offsetByCodePoints(offset, 1);
            onChunk.accept(text.substring(offset, next));
            offset = next;
            if (delay > 0 && offset < text.length() && !pause(delay)) {
                onChunk.accept(text.substring(offset));
                return;
            }
        }
    }

    void lineByLine(String text, Consumer<String> onChunk) {
        String normalized = normalizeNewlines(text);
        boolean endsWithNewline = normalized.endsWith("\n");
        String body = endsWithNewline ? normalized.substring(0, normalized.length() - 1) : normalized;
        String[] lines = body.split("\n", -1);

        for (int i = 0; i < lines.length; i++) {
            boolean last = i == lines.length - 1;
            String piece = last && !endsWithNewline ? lines[i] : lines[i] + "\n";
            if (!piece.isEmpty()) {
                onChunk.accept(piece);
            }
            if (!last && !pause(lineDelay(lines[i].length()))) {
                String rest = remainder(lines, i + 1, endsWithNewline);
                if (!rest.isEmpty()) {
                    onChunk.accept(rest);
                }
                return;
            }
        }
    }

    /**
     * Delay after a line of the given length, clamped to the configured bounds.
     */
    long lineDelay(int lineLength) {
        long jitterRange = Math.max(0, settings.getLineRandomMaxMs() - settings.getLineRandomMinMs());
        long jitter = settings.getLineRandomMinMs()
                + (jitterRange > 0 ? (long) (random.nextDouble() * jitterRange) : 0);
        long delay = settings.getLineBaseDelayMs() + lineLength * settings.getLineCharDelayMs() + jitter;
        return Math.max(settings.getLineMinDelayMs(), Math.min(delay, settings.getLineMaxDelayMs()));
    }

    static String normalizeNewlines(String text) {
        return text.replace("\r\n", "\n").replace("\r", "\n").replace("\\n", "\n");
    }

    private boolean pause(long millis) {
        try {
            sleeper.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("[Act] Pacing interrupted, flushing remaining text");
            return false;
        }
    }

    private static String remainder(String[] lines, int from, boolean endsWithNewline) {
        String rest = String.join("\n", Arrays.asList(lines).subList(from, lines.length));
        return endsWithNewline ? rest + "\n" : rest;
    }
}
