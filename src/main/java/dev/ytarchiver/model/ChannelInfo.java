package dev.ytarchiver.model;

/** Channel details as returned by the remote API */
public record ChannelInfo(String id, String name, String uploadsFeedId) {}
