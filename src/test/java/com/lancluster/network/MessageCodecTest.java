package com.lancluster.network;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BinaryNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lancluster.protocol.AuthResponseMessage;
import com.lancluster.protocol.DisconnectMessage;
import com.lancluster.protocol.ExecuteTaskMessage;
import com.lancluster.protocol.Message;
import com.lancluster.protocol.MessageType;
import com.lancluster.protocol.TaskResultMessage;
import com.lancluster.protocol.WorkUnit;
import com.lancluster.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

final class MessageCodecTest {

    @Test
    void executeTaskKeepsNestedArguments() throws Exception {
        ObjectNode args = Jsons.mapper().createObjectNode();
        args.putArray("values").add(1).add(2).add(3);
        args.putObject("options").put("verbose", true);

        Message decoded = MessageCodec.decode(MessageCodec.encode(
                new ExecuteTaskMessage("sum_0001", new WorkUnit("sum", args))));

        Assertions.assertEquals(MessageType.EXECUTE_TASK, decoded.getType());
        ExecuteTaskMessage execute = (ExecuteTaskMessage) decoded;
        Assertions.assertEquals("sum_0001", execute.getTaskId());
        Assertions.assertEquals(new WorkUnit("sum", args), execute.getWork());
    }

    @Test
    void byteArraysAreTaggedOnTheWireAndRestored() throws Exception {
        byte[] payload = {0, 1, 2, (byte) 0xff};
        ObjectNode result = Jsons.mapper().createObjectNode();
        result.set("blob", BinaryNode.valueOf(payload));
        result.putArray("list").add(BinaryNode.valueOf(payload));

        byte[] encoded = MessageCodec.encode(TaskResultMessage.success("t1", result));

        JsonNode wire = Jsons.mapper().readTree(new String(encoded, StandardCharsets.UTF_8));
        Assertions.assertEquals("AAEC/w==", wire.path("result").path("blob").path(MessageCodec.BINARY_TAG).asText());

        TaskResultMessage decoded = (TaskResultMessage) MessageCodec.decode(encoded);
        Assertions.assertArrayEquals(payload, decoded.getResult().get("blob").binaryValue());
        Assertions.assertArrayEquals(payload, decoded.getResult().get("list").get(0).binaryValue());
    }

    @Test
    void objectWithTagAndOtherKeysIsLeftAlone() throws Exception {
        ObjectNode result = Jsons.mapper().createObjectNode();
        result.put(MessageCodec.BINARY_TAG, "not-base64!");
        result.put("other", 1);

        TaskResultMessage decoded = (TaskResultMessage) MessageCodec.decode(
                MessageCodec.encode(TaskResultMessage.success("t1", result)));

        Assertions.assertEquals("not-base64!", decoded.getResult().get(MessageCodec.BINARY_TAG).asText());
    }

    @Test
    void authResponseCarriesSessionKey() throws Exception {
        byte[] key = new byte[32];
        key[0] = 42;

        AuthResponseMessage decoded = (AuthResponseMessage) MessageCodec.decode(
                MessageCodec.encode(AuthResponseMessage.accepted("Authentication successful", key)));

        Assertions.assertTrue(decoded.isSuccess());
        Assertions.assertArrayEquals(key, decoded.getEncryptionKey());
    }

    @Test
    void hexEncodedKeyIsAccepted() throws Exception {
        String json = "{\"type\":\"auth_response\",\"success\":true,\"message\":\"ok\",\"encryption_key\":\"0a0b\"}";

        AuthResponseMessage decoded = (AuthResponseMessage) MessageCodec.decode(json.getBytes(StandardCharsets.UTF_8));

        Assertions.assertArrayEquals(new byte[] {0x0a, 0x0b}, decoded.getEncryptionKey());
    }

    @Test
    void disconnectWithoutWorkerId() throws Exception {
        DisconnectMessage decoded = (DisconnectMessage) MessageCodec.decode(
                MessageCodec.encode(new DisconnectMessage(null)));
        Assertions.assertNull(decoded.getWorkerId());
    }

    @Test
    void unknownTypeIsReportedWithItsName() {
        byte[] json = "{\"type\":\"reboot\",\"now\":true}".getBytes(StandardCharsets.UTF_8);

        UnknownMessageTypeException e = Assertions.assertThrows(UnknownMessageTypeException.class,
                () -> MessageCodec.decode(json));
        Assertions.assertEquals("reboot", e.getTypeName());
    }

    @Test
    void missingFieldIsMalformed() {
        byte[] json = "{\"type\":\"heartbeat\"}".getBytes(StandardCharsets.UTF_8);
        Assertions.assertThrows(MalformedMessageException.class, () -> MessageCodec.decode(json));
    }

    @Test
    void invalidJsonIsMalformed() {
        byte[] json = "not json".getBytes(StandardCharsets.UTF_8);
        Assertions.assertThrows(MalformedMessageException.class, () -> MessageCodec.decode(json));
    }

    @Test
    void badBase64IsMalformed() {
        byte[] json = "{\"type\":\"task_result\",\"task_id\":\"t\",\"success\":true,\"result\":{\"__binary__\":\"@@@\"}}"
                .getBytes(StandardCharsets.UTF_8);
        Assertions.assertThrows(MalformedMessageException.class, () -> MessageCodec.decode(json));
    }
}
