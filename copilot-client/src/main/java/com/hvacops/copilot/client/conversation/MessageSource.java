package com.hvacops.copilot.client.conversation;

/**
 * A cited record shown under an assistant message.
 */
public record MessageSource(String snippet, String date, String type, String authorName, String authorEmail) {
}
