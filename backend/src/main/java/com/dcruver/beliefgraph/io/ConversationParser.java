package com.dcruver.beliefgraph.io;

import com.dcruver.beliefgraph.exception.ConversationFormatException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Parses exported chat transcripts in Markdown.
 *
 * Expected layout: a header carrying a {@code Link:} line with the conversation UUID,
 * then alternating {@code ## Prompt:} and {@code ## Response:} sections. A section may
 * open with a {@code M/D/YYYY, H:MM:SS AM/PM} timestamp line. Assistant reasoning is
 * exported as a fenced block starting with "Thought process"; it is moved out of the
 * message text into {@link ConversationMessage#getAssistantReasoning()}.
 */
@Component
@Slf4j
public class ConversationParser {

    private static final Pattern SECTION = Pattern.compile("^## (Prompt|Response):[ \\t]*$", Pattern.MULTILINE);
    private static final Pattern LINK_HEADER = Pattern.compile(
        "^\\W*Link:.*?([0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12})",
        Pattern.MULTILINE);
    private static final Pattern TIMESTAMP_LINE = Pattern.compile(
        "^\\d{1,2}/\\d{1,2}/\\d{4}, \\d{1,2}:\\d{2}:\\d{2} [AP]M$");
    private static final Pattern REASONING_BLOCK = Pattern.compile(
        "^(`{3,})[^\\n]*\\n(Thought process.*?)\\n\\1[ \\t]*$", Pattern.MULTILINE | Pattern.DOTALL);
    private static final Pattern EXTRA_BLANK_LINES = Pattern.compile("\\n{3,}");

    // Exports carry no zone; treated as UTC
    private static final DateTimeFormatter TIMESTAMP_FORMAT =
        DateTimeFormatter.ofPattern("M/d/yyyy, h:mm:ss a", Locale.US);

    /**
     * Read and parse one transcript file
     */
    public List<ConversationMessage> parseFile(Path filePath) {
        String content;
        try {
            content = Files.readString(filePath);
        } catch (IOException e) {
            throw new ConversationFormatException("Cannot read " + filePath, e);
        }
        return parse(content, filePath.getFileName().toString());
    }

    /**
     * Markdown transcripts in a directory, sorted by file name
     */
    public List<Path> listTranscripts(Path directory) {
        if (!Files.isDirectory(directory)) {
            throw new ConversationFormatException("Not a directory: " + directory);
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files
                .filter(Files::isRegularFile)
                .filter(p -> p.getFileName().toString().endsWith(".md"))
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new ConversationFormatException("Cannot list " + directory, e);
        }
    }

    /**
     * Parse transcript content.
     *
     * @param content    Full file content; character offsets refer to it
     * @param sourceFile File name recorded on each message
     * @throws ConversationFormatException if there is no session link or no message section
     */
    public List<ConversationMessage> parse(String content, String sourceFile) {
        Matcher section = SECTION.matcher(content);
        List<int[]> bounds = new ArrayList<>();
        List<MessageRole> roles = new ArrayList<>();
        while (section.find()) {
            bounds.add(new int[]{section.start(), section.end()});
            roles.add("Prompt".equals(section.group(1)) ? MessageRole.USER : MessageRole.ASSISTANT);
        }
        if (bounds.isEmpty()) {
            throw new ConversationFormatException(sourceFile + ": no Prompt or Response sections");
        }

        String header = content.substring(0, bounds.get(0)[0]);
        Matcher link = LINK_HEADER.matcher(header);
        if (!link.find()) {
            throw new ConversationFormatException(sourceFile + ": no Link header with a conversation id");
        }
        String sessionId = link.group(1).toLowerCase(Locale.ROOT);

        List<ConversationMessage> messages = new ArrayList<>();
        for (int i = 0; i < bounds.size(); i++) {
            int start = bounds.get(i)[0];
            int end = i + 1 < bounds.size() ? bounds.get(i + 1)[0] : content.length();
            messages.add(toMessage(content.substring(bounds.get(i)[1], end), roles.get(i),
                sessionId, i, start, end, sourceFile));
        }

        log.debug("Parsed {} messages from {} (session {})", messages.size(), sourceFile, sessionId);
        return messages;
    }

    private ConversationMessage toMessage(String body, MessageRole role, String sessionId,
                                          int index, int start, int end, String sourceFile) {
        String remaining = body.strip();
        Instant timestamp = null;

        int lineEnd = remaining.indexOf('\n');
        String firstLine = (lineEnd < 0 ? remaining : remaining.substring(0, lineEnd)).strip();
        if (TIMESTAMP_LINE.matcher(firstLine).matches()) {
            timestamp = parseTimestamp(firstLine);
            remaining = lineEnd < 0 ? "" : remaining.substring(lineEnd + 1);
        }

        String reasoning = null;
        if (role == MessageRole.ASSISTANT) {
            Matcher block = REASONING_BLOCK.matcher(remaining);
            List<String> thoughts = new ArrayList<>();
            StringBuilder stripped = new StringBuilder();
            while (block.find()) {
                thoughts.add(block.group(2).strip());
                block.appendReplacement(stripped, "");
            }
            block.appendTail(stripped);
            remaining = stripped.toString();
            if (!thoughts.isEmpty()) {
                reasoning = String.join("\n\n", thoughts);
            }
        }

        return ConversationMessage.builder()
            .text(EXTRA_BLANK_LINES.matcher(remaining.strip()).replaceAll("\n\n"))
            .role(role)
            .timestamp(timestamp)
            .sessionId(sessionId)
            .messageIndex(index)
            .sourceCharStart(start)
            .sourceCharEnd(end)
            .sourceFile(sourceFile)
            .assistantReasoning(reasoning)
            .build();
    }

    private Instant parseTimestamp(String line) {
        try {
            return LocalDateTime.parse(line, TIMESTAMP_FORMAT).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            log.warn("Failed to parse timestamp: {}", line);
            return null;
        }
    }
}
