package lpp.scope;

import java.util.AbstractMap;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 *
 * A map that extends another map. Lookups fall through to the parent when the key is not one of this map's
 * members; modifications only affect the members, never the parent.
 *
 * @param <K> The key type
 * @param <V> The value type
 */
public class ChainMap<K, V> extends AbstractMap<K, V> {
	private final Map<K, V> parent;
	private final Map<K, V> members;

	public ChainMap(Map<K, V> members, Map<K, V> parent) {
		this.members = members;
		this.parent = parent;
	}

	public Map<K, V> getParent() {
		return parent;
	}

	@Override
	public boolean containsKey(Object k) {
		return members.containsKey(k) || parent.containsKey(k);
	}

	@Override
	public V get(Object k) {
		V result = members.get(k);
		if (result == null) {
			return parent.get(k);
		}
		return result;
	}

	@Override
	public V put(K k, V v) {
		return members.put(k, v);
	}

	@Override
	public V remove(Object k) {
		return members.remove(k);
	}

	@Override
	public Set<Entry<K, V>> entrySet() {
		// members shadow the parent
		Map<K, V> result = new HashMap<>(parent);
		result.putAll(members);
		return result.entrySet();
	}

}
