package com.lancluster.network;

import javax.crypto.SecretKey;
import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;

/**
 * Connected socket pairs on the loopback interface for channel tests.
 */
public final class LoopbackSockets {

    private LoopbackSockets() {
    }

    /**
     * @return {client, server} ends of one TCP connection
     */
    public static Socket[] pair() throws IOException {
        try (ServerSocket server = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            Socket client = new Socket(InetAddress.getLoopbackAddress(), server.getLocalPort());
            Socket accepted = server.accept();
            return new Socket[] {client, accepted};
        }
    }

    /**
     * @return {client, server} channels sharing one key
     */
    public static FramedChannel[] channels(SecretKey key) throws IOException {
        Socket[] sockets = pair();
        return new FramedChannel[] {new FramedChannel(sockets[0], key), new FramedChannel(sockets[1], key)};
    }
}
