package dev.ytarchiver.config;

import dev.ytarchiver.archiver.ArchiverException;

/** The configuration file is missing, unreadable or invalid */
public class ConfigException extends ArchiverException {

	public ConfigException(String message) {
		super(message);
	}

	public ConfigException(String message, Throwable cause) {
		super(message, cause);
	}
}
