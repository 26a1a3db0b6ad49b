package com.deepansh.agenthost.data;

import com.deepansh.agenthost.exception.DataFormatException;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.SubmissionPublisher;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DataTest {

    @Test
    void fromStream_drainsSourceOnce_andReadsAreRepeatable() {
        AtomicInteger pulls = new AtomicInteger();
        Iterator<String> source = countingIterator(List.of("hel", "lo"), pulls);
        Data data = Data.fromStream(source, "text/plain");

        assertThat(data.isMaterialized()).isFalse();
        assertThat(data.text()).isEqualTo("hello");
        assertThat(data.isMaterialized()).isTrue();
        assertThat(data.text()).isEqualTo("hello");
        assertThat(data.binary()).isEqualTo("hello".getBytes(StandardCharsets.UTF_8));
        assertThat(data.base64()).isEqualTo("aGVsbG8=");
        assertThat(pulls.get()).isEqualTo(2);
    }

    @Test
    void fromStream_acceptsMixedChunkTypes() {
        Data data = Data.fromStream(List.of(
                "a".getBytes(StandardCharsets.UTF_8),
                "b",
                ByteBuffer.wrap("c".getBytes(StandardCharsets.UTF_8)),
                Data.of("d", "text/plain")), "text/plain");

        assertThat(data.text()).isEqualTo("abcd");
    }

    @Test
    void fromStream_unsupportedChunk_throwsDataFormat() {
        Data data = Data.fromStream(List.of(42), "text/plain");

        assertThatThrownBy(data::text)
                .isInstanceOf(DataFormatException.class)
                .hasMessageContaining("Unsupported value type");
    }

    @Test
    void stream_textIsSplitOnNewlines_keepingTerminators() {
        Data data = Data.of("one\ntwo\nthree", "text/plain");

        assertThat(chunks(data.stream())).containsExactly("one\n", "two\n", "three");
    }

    @Test
    void stream_jsonIsChunkedLikeText() {
        Data data = Data.of("{\"a\":1}\n{\"a\":2}\n", "application/json");

        assertThat(chunks(data.stream())).containsExactly("{\"a\":1}\n", "{\"a\":2}\n");
    }

    @Test
    void stream_binaryIsSingleChunk() {
        Data data = Data.of("x\ny\nz", "application/octet-stream");

        assertThat(chunks(data.stream())).containsExactly("x\ny\nz");
    }

    @Test
    void stream_concatenationEqualsBinary() {
        Data data = Data.fromStream(List.of("line 1\nline", " 2\n"), "text/plain");

        assertThat(String.join("", chunks(data.stream()))).isEqualTo(new String(data.binary(), StandardCharsets.UTF_8));
    }

    @Test
    void json_parsesObject() {
        JsonNode node = Data.of("{\"name\":\"bob\",\"age\":3}", "application/json").json();

        assertThat(node.get("name").asText()).isEqualTo("bob");
        assertThat(node.get("age").asInt()).isEqualTo(3);
    }

    @Test
    void json_empty_throwsDataFormat() {
        assertThatThrownBy(() -> Data.empty("application/json").json())
                .isInstanceOf(DataFormatException.class)
                .hasMessage("Cannot parse empty JSON");
    }

    @Test
    void json_invalid_throwsDataFormat() {
        assertThatThrownBy(() -> Data.of("not json", "text/plain").json())
                .isInstanceOf(DataFormatException.class)
                .hasMessage("The content type is not valid JSON");
    }

    @Test
    void json_trailingGarbage_throwsDataFormat() {
        Data data = Data.of("{\"a\":1} this is not json", "application/json");

        assertThatThrownBy(data::json)
                .isInstanceOf(DataFormatException.class)
                .hasMessage("The content type is not valid JSON");
        assertThatThrownBy(() -> data.object(Map.class))
                .isInstanceOf(DataFormatException.class);
    }

    @Test
    void object_mapsToType() {
        @SuppressWarnings("unchecked")
        Map<String, Object> value = Data.of("{\"k\":\"v\"}", "application/json").object(Map.class);

        assertThat(value).containsEntry("k", "v");
    }

    @Test
    void object_wrongShape_throwsDataFormat() {
        assertThatThrownBy(() -> Data.of("[1,2]", "application/json").object(Map.class))
                .isInstanceOf(DataFormatException.class)
                .hasMessageStartingWith("Failed to parse object");
    }

    @Test
    void fromBase64_decodes() {
        Data data = Data.fromBase64("aGk=", "text/plain");

        assertThat(data.text()).isEqualTo("hi");
        assertThat(data.contentType()).isEqualTo("text/plain");
    }

    @Test
    void fromBase64_invalid_throwsDataFormat() {
        assertThatThrownBy(() -> Data.fromBase64("***", "text/plain"))
                .isInstanceOf(DataFormatException.class);
    }

    @Test
    void empty_readsAsEmptyText() {
        Data data = Data.empty("text/plain");

        assertThat(data.text()).isEmpty();
        assertThat(data.binary()).isEmpty();
    }

    @Test
    void binary_returnsDefensiveCopy() {
        Data data = Data.of(new byte[]{1, 2, 3}, "application/octet-stream");
        byte[] first = data.binary();
        first[0] = 9;

        assertThat(data.binary()).containsExactly(1, 2, 3);
    }

    @Test
    void from_picksContentTypeByValueShape() {
        assertThat(Data.from("hi", null).contentType()).isEqualTo("text/plain");
        assertThat(Data.from(new byte[]{1}, null).contentType()).isEqualTo("application/octet-stream");
        assertThat(Data.from(Map.of("a", 1), null).contentType()).isEqualTo("application/json");
        assertThat(Data.from(Map.of("a", 1), null).text()).isEqualTo("{\"a\":1}");
        assertThat(Data.from("<p/>", "text/html").contentType()).isEqualTo("text/html");
    }

    @Test
    void from_dataKeepsItsOwnContentType() {
        Data original = Data.of("x", "text/markdown");

        assertThat(Data.from(original, "application/pdf")).isSameAs(original);
    }

    @Test
    void fromPublisher_collectsAllItems() {
        Data data;
        try (SubmissionPublisher<String> publisher = new SubmissionPublisher<>()) {
            data = Data.fromPublisher(publisher, "text/plain");
            Thread producer = new Thread(() -> {
                while (publisher.getNumberOfSubscribers() == 0) {
                    Thread.onSpinWait();
                }
                publisher.submit("a");
                publisher.submit("b");
                publisher.close();
            });
            producer.start();
            assertThat(data.text()).isEqualTo("ab");
        }
    }

    private static List<String> chunks(Iterator<byte[]> it) {
        List<String> out = new ArrayList<>();
        it.forEachRemaining(bytes -> out.add(new String(bytes, StandardCharsets.UTF_8)));
        return out;
    }

    private static <T> Iterator<T> countingIterator(List<T> items, AtomicInteger pulls) {
        Iterator<T> delegate = items.iterator();
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return delegate.hasNext();
            }

            @Override
            public T next() {
                pulls.incrementAndGet();
                return delegate.next();
            }
        };
    }
}
