package com.lancluster.network;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.BinaryNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lancluster.protocol.AuthMessage;
import com.lancluster.protocol.AuthResponseMessage;
import com.lancluster.protocol.DisconnectMessage;
import com.lancluster.protocol.ExecuteTaskMessage;
import com.lancluster.protocol.FileTransferEndMessage;
import com.lancluster.protocol.FileTransferStartMessage;
import com.lancluster.protocol.HeartbeatMessage;
import com.lancluster.protocol.HeartbeatResponseMessage;
import com.lancluster.protocol.Message;
import com.lancluster.protocol.MessageType;
import com.lancluster.protocol.TaskResultMessage;
import com.lancluster.protocol.WorkUnit;
import com.lancluster.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.Map;

/**
 * Converts messages to and from the plaintext carried inside a frame.
 *
 * The plaintext is a UTF-8 JSON tree. Raw byte arrays anywhere in the tree
 * (Jackson {@link BinaryNode}s) are written as the one-key object
 * {@code {"__binary__": "<base64>"}} and turned back into byte arrays on read,
 * so the whole tree stays representable as text.
 */
public final class MessageCodec {

    /** Reserved key marking a wrapped byte array */
    public static final String BINARY_TAG = "__binary__";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private MessageCodec() {
    }

    // ==================== Encoding ====================

    /**
     * @return UTF-8 bytes of the text-safe tree for this message
     */
    public static byte[] encode(Message message) {
        JsonNode tree = wrapBinary(toTree(message));
        try {
            return Jsons.mapper().writeValueAsBytes(tree);
        } catch (JsonProcessingException e) {
            // a tree built from JsonNodes always serializes
            throw new IllegalStateException("Failed to serialize " + message.getType(), e);
        }
    }

    /**
     * Builds the logical tree of a message, byte arrays still as {@link BinaryNode}.
     */
    static ObjectNode toTree(Message message) {
        ObjectNode node = NODES.objectNode();
        node.put("type", message.getType().getWireName());

        switch (message.getType()) {
            case AUTH: {
                AuthMessage auth = (AuthMessage) message;
                node.put("otp", auth.getOtp());
                node.put("worker_id", auth.getWorkerId());
                node.put("hostname", auth.getHostname());
                break;
            }
            case AUTH_RESPONSE: {
                AuthResponseMessage response = (AuthResponseMessage) message;
                node.put("success", response.isSuccess());
                node.put("message", response.getMessage());
                if (response.hasEncryptionKey()) {
                    node.set("encryption_key", BinaryNode.valueOf(response.getEncryptionKey()));
                }
                break;
            }
            case HEARTBEAT:
                node.put("worker_id", ((HeartbeatMessage) message).getWorkerId());
                break;
            case HEARTBEAT_RESPONSE:
            case FILE_TRANSFER_END:
                break;
            case EXECUTE_TASK: {
                ExecuteTaskMessage execute = (ExecuteTaskMessage) message;
                node.put("task_id", execute.getTaskId());
                ObjectNode work = node.putObject("work");
                work.put("handler", execute.getWork().getHandler());
                work.set("args", execute.getWork().getArguments());
                break;
            }
            case TASK_RESULT: {
                TaskResultMessage result = (TaskResultMessage) message;
                node.put("task_id", result.getTaskId());
                node.set("result", result.getResult());
                node.put("success", result.isSuccess());
                break;
            }
            case DISCONNECT: {
                String workerId = ((DisconnectMessage) message).getWorkerId();
                if (workerId != null) {
                    node.put("worker_id", workerId);
                }
                break;
            }
            case FILE_TRANSFER_START: {
                FileTransferStartMessage start = (FileTransferStartMessage) message;
                node.put("filename", start.getFilename());
                node.put("size", start.getSize());
                break;
            }
            default:
                throw new IllegalArgumentException("Unsupported message type: " + message.getType());
        }
        return node;
    }

    // ==================== Decoding ====================

    /**
     * Parses the plaintext of a frame.
     *
     * @throws UnknownMessageTypeException if the discriminator is not a known type
     * @throws MalformedMessageException if the content is not a valid message
     */
    public static Message decode(byte[] plaintext) throws MalformedMessageException {
        JsonNode raw;
        try {
            raw = Jsons.mapper().readTree(new String(plaintext, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new MalformedMessageException("Frame is not valid JSON", e);
        }
        if (raw == null || !raw.isObject()) {
            throw new MalformedMessageException("Frame is not a JSON object");
        }
        JsonNode tree = unwrapBinary(raw);
        return fromTree(tree);
    }

    static Message fromTree(JsonNode node) throws MalformedMessageException {
        JsonNode typeNode = node.get("type");
        if (typeNode == null || !typeNode.isTextual()) {
            throw new MalformedMessageException("Message has no textual 'type' field");
        }
        MessageType type = MessageType.fromWireName(typeNode.asText());
        if (type == null) {
            throw new UnknownMessageTypeException(typeNode.asText());
        }

        switch (type) {
            case AUTH:
                return new AuthMessage(
                        requireText(node, "otp"),
                        requireText(node, "worker_id"),
                        optionalText(node, "hostname"));
            case AUTH_RESPONSE:
                return AuthResponseMessage.of(
                        requireBoolean(node, "success"),
                        optionalText(node, "message"),
                        optionalKey(node, "encryption_key"));
            case HEARTBEAT:
                return new HeartbeatMessage(requireText(node, "worker_id"));
            case HEARTBEAT_RESPONSE:
                return HeartbeatResponseMessage.INSTANCE;
            case EXECUTE_TASK: {
                JsonNode work = node.get("work");
                if (work == null || !work.isObject()) {
                    throw new MalformedMessageException("execute_task has no 'work' object");
                }
                return new ExecuteTaskMessage(
                        requireText(node, "task_id"),
                        new WorkUnit(requireText(work, "handler"), work.get("args")));
            }
            case TASK_RESULT:
                return new TaskResultMessage(
                        requireText(node, "task_id"),
                        node.get("result"),
                        requireBoolean(node, "success"));
            case DISCONNECT:
                return new DisconnectMessage(optionalText(node, "worker_id"));
            case FILE_TRANSFER_START: {
                JsonNode size = node.get("size");
                if (size == null || !size.canConvertToLong() || size.asLong() < 0) {
                    throw new MalformedMessageException("file_transfer_start has no valid 'size'");
                }
                return new FileTransferStartMessage(requireText(node, "filename"), size.asLong());
            }
            case FILE_TRANSFER_END:
                return FileTransferEndMessage.INSTANCE;
            default:
                throw new UnknownMessageTypeException(type.getWireName());
        }
    }

    // ==================== Binary tagging ====================

    /**
     * Returns a copy of the tree where every {@link BinaryNode} is replaced by
     * {@code {"__binary__": "<base64>"}}.
     */
    public static JsonNode wrapBinary(JsonNode node) {
        if (node == null) {
            return null;
        }
        if (node.isBinary()) {
            ObjectNode tagged = NODES.objectNode();
            tagged.put(BINARY_TAG, Base64.getEncoder().encodeToString(((BinaryNode) node).binaryValue()));
            return tagged;
        }
        if (node.isObject()) {
            ObjectNode copy = NODES.objectNode();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                copy.set(field.getKey(), wrapBinary(field.getValue()));
            }
            return copy;
        }
        if (node.isArray()) {
            ArrayNode copy = NODES.arrayNode(node.size());
            for (JsonNode item : node) {
                copy.add(wrapBinary(item));
            }
            return copy;
        }
        return node;
    }

    /**
     * Inverse of {@link #wrapBinary(JsonNode)}.
     *
     * @throws MalformedMessageException if a tagged object does not hold valid base64
     */
    public static JsonNode unwrapBinary(JsonNode node) throws MalformedMessageException {
        if (node == null) {
            return null;
        }
        if (node.isObject()) {
            if (node.size() == 1 && node.has(BINARY_TAG)) {
                JsonNode encoded = node.get(BINARY_TAG);
                if (!encoded.isTextual()) {
                    throw new MalformedMessageException("Tagged byte array is not a base64 string");
                }
                try {
                    return BinaryNode.valueOf(Base64.getDecoder().decode(encoded.asText()));
                } catch (IllegalArgumentException e) {
                    throw new MalformedMessageException("Tagged byte array is not valid base64", e);
                }
            }
            ObjectNode copy = NODES.objectNode();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                copy.set(field.getKey(), unwrapBinary(field.getValue()));
            }
            return copy;
        }
        if (node.isArray()) {
            ArrayNode copy = NODES.arrayNode(node.size());
            for (JsonNode item : node) {
                copy.add(unwrapBinary(item));
            }
            return copy;
        }
        return node;
    }

    // ==================== Field helpers ====================

    private static String requireText(JsonNode node, String field) throws MalformedMessageException {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw new MalformedMessageException("Missing or non-text field '" + field + "'");
        }
        return value.asText();
    }

    private static String optionalText(JsonNode node, String field) throws MalformedMessageException {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw new MalformedMessageException("Field '" + field + "' is not text");
        }
        return value.asText();
    }

    private static boolean requireBoolean(JsonNode node, String field) throws MalformedMessageException {
        JsonNode value = node.get(field);
        if (value == null || !value.isBoolean()) {
            throw new MalformedMessageException("Missing or non-boolean field '" + field + "'");
        }
        return value.booleanValue();
    }

    /**
     * Keys normally arrive as tagged byte arrays; a hex string is accepted too.
     */
    private static byte[] optionalKey(JsonNode node, String field) throws MalformedMessageException {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isBinary()) {
            return ((BinaryNode) value).binaryValue();
        }
        if (value.isTextual()) {
            try {
                return HexFormat.of().parseHex(value.asText());
            } catch (IllegalArgumentException e) {
                throw new MalformedMessageException("Field '" + field + "' is not a valid hex key", e);
            }
        }
        throw new MalformedMessageException("Field '" + field + "' is not a byte array");
    }
}
