package com.wtbmonitor.market.state;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ProgressChannelTest {

    @Test
    void drainDeliversMessagesInOrderUntilClosed() throws Exception {
        ProgressChannel channel = new ProgressChannel();
        List<String> received = Collections.synchronizedList(new ArrayList<>());
        Thread consumer = new Thread(() -> {
            try {
                channel.drain(received::add);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        consumer.start();

        channel.publish("one");
        channel.publish("two");
        channel.publish("three");
        channel.close();
        consumer.join(5_000);

        assertThat(consumer.isAlive()).isFalse();
        assertThat(received).containsExactly("one", "two", "three");
    }

    @Test
    void messagesAfterCloseAreDropped() throws Exception {
        ProgressChannel channel = new ProgressChannel();
        channel.publish("kept");
        channel.close();
        channel.publish("dropped");
        channel.close();

        List<String> received = new ArrayList<>();
        channel.drain(received::add);

        assertThat(received).containsExactly("kept");
        assertThat(channel.isClosed()).isTrue();
    }
}
