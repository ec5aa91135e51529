package fi.seco.wordchef.entities;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Distinct entity mentions per type, in order of first appearance.
 */
public final class Entities {

	private static final Entities UNAVAILABLE = new Entities(Collections.<EntityType, Set<String>> emptyMap(), false);

	private final Map<EntityType, Set<String>> mentions;
	private final boolean available;

	public Entities(Map<EntityType, ? extends Set<String>> mentions) {
		this(mentions, true);
	}

	private Entities(Map<EntityType, ? extends Set<String>> mentions, boolean available) {
		Map<EntityType, Set<String>> m = new EnumMap<EntityType, Set<String>>(EntityType.class);
		for (Map.Entry<EntityType, ? extends Set<String>> e : mentions.entrySet())
			m.put(e.getKey(), Collections.unmodifiableSet(new LinkedHashSet<String>(e.getValue())));
		this.mentions = Collections.unmodifiableMap(m);
		this.available = available;
	}

	public static Entities unavailable() {
		return UNAVAILABLE;
	}

	public Set<String> get(EntityType type) {
		Set<String> s = mentions.get(type);
		return s == null ? Collections.<String> emptySet() : s;
	}

	/**
	 * @return false when no recognizer could run, as opposed to one that
	 *         found nothing
	 */
	public boolean isAvailable() {
		return available;
	}

	public boolean isEmpty() {
		for (Set<String> s : mentions.values())
			if (!s.isEmpty()) return false;
		return true;
	}

	@Override
	public String toString() {
		return available ? mentions.toString() : "unavailable";
	}
}
