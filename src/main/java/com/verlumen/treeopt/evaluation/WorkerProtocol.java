package com.verlumen.treeopt.evaluation;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Line-oriented JSON protocol spoken with worker processes.
 *
 * <ul>
 *   <li>On startup the worker prints {@code {"ready": true}}.
 *   <li>A request is one line: {@code {"id": 7, "allocation": [..], "root": 1, "selections":
 *       {"12": 3}}}.
 *   <li>The response echoes the id: {@code {"id": 7, "success": true, "metrics": {"dps": ..}}} or
 *       {@code {"id": 7, "success": false, "error": ".."}}.
 *   <li>{@code PING} is answered with {@code {"pong": true}}; {@code EXIT} asks the worker to quit.
 * </ul>
 *
 * <p>Lines that are not JSON objects are worker debug output and are skipped.
 */
final class WorkerProtocol {
  static final String PING = "PING";
  static final String EXIT = "EXIT";

  static String encode(EvaluationRequest request) {
    JsonObject json = new JsonObject();
    json.addProperty("id", request.requestId());
    JsonArray nodes = new JsonArray();
    request.allocation().nodes().forEach(nodes::add);
    json.add("allocation", nodes);
    json.addProperty("root", request.allocation().root());
    JsonObject selections = new JsonObject();
    for (Map.Entry<Integer, Integer> selection :
        request.allocation().masterySelections().entrySet()) {
      selections.addProperty(String.valueOf(selection.getKey()), selection.getValue());
    }
    json.add("selections", selections);
    return json.toString();
  }

  /** The line as a JSON object, or empty for debug output. */
  static Optional<JsonObject> parse(String line) {
    String trimmed = line.trim();
    if (!trimmed.startsWith("{")) {
      return Optional.empty();
    }
    try {
      JsonElement element = JsonParser.parseString(trimmed);
      return element.isJsonObject() ? Optional.of(element.getAsJsonObject()) : Optional.empty();
    } catch (JsonParseException e) {
      return Optional.empty();
    }
  }

  static boolean isReady(JsonObject message) {
    return isTrue(message, "ready");
  }

  static boolean isPong(JsonObject message) {
    return isTrue(message, "pong");
  }

  static boolean isResponse(JsonObject message) {
    return message.has("success");
  }

  /** The echoed request id, or empty when the worker does not echo ids. */
  static OptionalLong responseId(JsonObject message) {
    JsonElement id = message.get("id");
    if (id == null || !id.isJsonPrimitive() || !id.getAsJsonPrimitive().isNumber()) {
      return OptionalLong.empty();
    }
    return OptionalLong.of(id.getAsLong());
  }

  static EvaluationResult decode(JsonObject response) {
    if (!isTrue(response, "success")) {
      JsonElement error = response.get("error");
      String message =
          error != null && error.isJsonPrimitive()
              ? error.getAsString()
              : "Worker reported failure";
      return EvaluationResult.failure(FailureKind.REJECTED, message);
    }
    JsonElement metrics = response.get("metrics");
    if (metrics == null || !metrics.isJsonObject()) {
      return EvaluationResult.failure(FailureKind.MALFORMED_RESPONSE, "Response has no metrics");
    }
    try {
      return EvaluationResult.success(EvaluationMetrics.fromJson(metrics.getAsJsonObject()));
    } catch (IllegalArgumentException e) {
      return EvaluationResult.failure(FailureKind.MALFORMED_RESPONSE, e.getMessage());
    }
  }

  private static boolean isTrue(JsonObject message, String key) {
    JsonElement value = message.get(key);
    return value != null
        && value.isJsonPrimitive()
        && value.getAsJsonPrimitive().isBoolean()
        && value.getAsBoolean();
  }

  private WorkerProtocol() {}
}
