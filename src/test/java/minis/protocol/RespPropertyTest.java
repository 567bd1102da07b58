package minis.protocol;

import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;

import static org.junit.jupiter.api.Assertions.*;

public class RespPropertyTest {

    @Property
    void decodeInvertsEncode(@ForAll("values") RespValue value) throws IOException {
        InputStream in = new ByteArrayInputStream(Resp.encode(value));
        assertEquals(value, Resp.decode(in));
        assertEquals(-1, in.read(), "decoder must consume exactly one frame");
    }

    @Property
    void decodingArbitraryBytesOnlyFailsWithRespException(@ForAll byte[] bytes) {
        try {
            Resp.decode(new ByteArrayInputStream(bytes));
        } catch (RespException e) {
            assertNotNull(e.getKind());
        } catch (IOException e) {
            fail("Unexpected I/O failure from an in-memory stream: " + e);
        }
    }

    @Provide
    Arbitrary<RespValue> values() {
        Arbitrary<RespValue> scalar = scalars();
        Arbitrary<RespValue> flat = scalar.list().ofMaxSize(5).map(RespArray::of);
        Arbitrary<RespValue> nested = Arbitraries.oneOf(scalar, flat).list().ofMaxSize(4).map(RespArray::of);
        return Arbitraries.oneOf(scalar, flat, nested);
    }

    private Arbitrary<RespValue> scalars() {
        Arbitrary<String> lineText = Arbitraries.strings()
                .alpha().numeric().withChars(' ', '-', '_', ':', '*', '$')
                .ofMaxLength(30);
        Arbitrary<RespValue> simple = lineText.map(RespSimpleString::new);
        Arbitrary<RespValue> error = lineText.map(RespError::new);
        Arbitrary<RespValue> integer = Arbitraries.longs().map(RespInteger::new);
        Arbitrary<RespValue> bulk = Arbitraries.bytes().array(byte[].class).ofMaxSize(64).map(RespBulkString::of);
        return Arbitraries.oneOf(simple, error, integer, bulk);
    }
}
