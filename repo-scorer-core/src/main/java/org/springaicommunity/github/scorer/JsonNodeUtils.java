package org.springaicommunity.github.scorer;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Static helpers for navigating GraphQL response trees.
 *
 * <p>
 * A JSON {@code null} and a missing field are treated alike: both yield an empty result,
 * which is how the GitHub API reports an absent repository or user.
 */
public final class JsonNodeUtils {

	private JsonNodeUtils() {
	}

	/**
	 * Navigate to the node at the given path.
	 * @param node starting node
	 * @param path field names
	 * @return the node, or empty if it is missing or JSON null
	 */
	public static Optional<JsonNode> getNode(JsonNode node, String... path) {
		JsonNode target = node;
		for (String p : path) {
			target = target.path(p);
		}
		return target.isMissingNode() || target.isNull() ? Optional.empty() : Optional.of(target);
	}

	public static Optional<String> getString(JsonNode node, String... path) {
		return getNode(node, path).filter(JsonNode::isValueNode).map(JsonNode::asText);
	}

	public static Optional<Integer> getInt(JsonNode node, String... path) {
		return getNode(node, path).filter(JsonNode::isNumber).map(JsonNode::asInt);
	}

	public static boolean getBoolean(JsonNode node, String... path) {
		return getNode(node, path).map(n -> n.asBoolean(false)).orElse(false);
	}

	public static List<JsonNode> getArray(JsonNode node, String... path) {
		Optional<JsonNode> target = getNode(node, path);
		if (target.isPresent() && target.get().isArray()) {
			List<JsonNode> result = new ArrayList<>();
			target.get().forEach(result::add);
			return result;
		}
		return List.of();
	}

}
