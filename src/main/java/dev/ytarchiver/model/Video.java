package dev.ytarchiver.model;

/** A single item of a channel's uploads feed */
public record Video(String videoId, String channelId, String title, String description) {}
