package dev.ytarchiver.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.ytarchiver.model.ChannelIdentity;
import java.util.List;

/** A channel entry of the configuration file */
public record ChannelConfig(
		@JsonProperty("id") String id,
		@JsonProperty("handle") String handle,
		@JsonProperty("username") String username,
		@JsonProperty("selectors") List<SelectorConfig> selectors) {

	public ChannelConfig {
		selectors = selectors == null ? List.of() : List.copyOf(selectors);
	}

	@JsonIgnore
	public ChannelIdentity identity() {
		return new ChannelIdentity(id, handle, username);
	}
}
