package dev.ytarchiver.model;

/**
 * Identifies a channel by one of its identifiers. Only the most specific identifier that is set
 * is used: channel ID first, then handle, then legacy username.
 */
public record ChannelIdentity(String id, String handle, String username) {

	public static ChannelIdentity ofId(String id) {
		return new ChannelIdentity(id, null, null);
	}

	public static ChannelIdentity ofHandle(String handle) {
		return new ChannelIdentity(null, handle, null);
	}

	public static ChannelIdentity ofUsername(String username) {
		return new ChannelIdentity(null, null, username);
	}

	public enum Kind {
		ID,
		HANDLE,
		USERNAME
	}

	/** The kind of identifier that wins, or null if none is set */
	public Kind kind() {
		if (isSet(id)) {
			return Kind.ID;
		}
		if (isSet(handle)) {
			return Kind.HANDLE;
		}
		if (isSet(username)) {
			return Kind.USERNAME;
		}
		return null;
	}

	/** The value of the winning identifier, or null if none is set */
	public String value() {
		Kind kind = kind();
		if (kind == null) {
			return null;
		}
		return switch (kind) {
			case ID -> id;
			case HANDLE -> handle;
			case USERNAME -> username;
		};
	}

	public boolean isEmpty() {
		return kind() == null;
	}

	/** Number of identifiers that are set; more than one means the lower priority ones are ignored */
	public int identifierCount() {
		int count = 0;
		for (String s : new String[] {id, handle, username}) {
			if (isSet(s)) {
				count++;
			}
		}
		return count;
	}

	private static boolean isSet(String s) {
		return s != null && !s.isBlank();
	}

	@Override
	public String toString() {
		String value = value();
		return value != null ? value : "unknown";
	}
}
