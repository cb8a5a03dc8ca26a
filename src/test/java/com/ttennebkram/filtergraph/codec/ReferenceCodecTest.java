package com.ttennebkram.filtergraph.codec;

import com.ttennebkram.filtergraph.model.InputReference;
import com.ttennebkram.filtergraph.model.StandardSource;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReferenceCodecTest {

    @Test
    void rawNullAndReservedDecodeToUnspecified() {
        assertThat(ReferenceCodec.decode(null)).isEqualTo(InputReference.unspecified());
        assertThat(ReferenceCodec.decode(-1)).isEqualTo(InputReference.unspecified());
    }

    @Test
    void rawNonNegativeIsNamedResult() {
        assertThat(ReferenceCodec.decode(0)).isEqualTo(InputReference.namedResult(0));
        assertThat(ReferenceCodec.decode(42)).isEqualTo(InputReference.namedResult(42));
    }

    @Test
    void rawBelowReservedIsStandardSource() {
        assertThat(ReferenceCodec.decode(-2))
            .isEqualTo(InputReference.standardSource(StandardSource.SOURCE_GRAPHIC));
        assertThat(ReferenceCodec.decode(-7))
            .isEqualTo(InputReference.standardSource(StandardSource.STROKE_PAINT));
    }

    @Test
    void everyLegalRawValueRoundTrips() {
        for (int raw = -50; raw <= 50; raw++) {
            if (raw == -1) {
                continue;
            }
            assertThat(ReferenceCodec.encode(ReferenceCodec.decode(raw))).isEqualTo(raw);
        }
        assertThat(ReferenceCodec.encode(ReferenceCodec.decode(null))).isNull();
    }

    @Test
    void encodeNullReferenceIsNull() {
        assertThat(ReferenceCodec.encode(null)).isNull();
        assertThat(ReferenceCodec.encode(InputReference.unspecified())).isNull();
    }

    @Test
    void parsesStandardKeysAndResultNames() {
        assertThat(ReferenceCodec.fromAttribute("SourceAlpha"))
            .isEqualTo(InputReference.standardSource(StandardSource.SOURCE_ALPHA));
        assertThat(ReferenceCodec.fromAttribute(" result3 ")).isEqualTo(InputReference.namedResult(3));
        assertThat(ReferenceCodec.fromAttribute("-4"))
            .isEqualTo(InputReference.standardSource(StandardSource.BACKGROUND_IMAGE));
    }

    @Test
    void malformedAttributesReadAsUnspecified() {
        assertThat(ReferenceCodec.fromAttribute(null).isUnspecified()).isTrue();
        assertThat(ReferenceCodec.fromAttribute("").isUnspecified()).isTrue();
        assertThat(ReferenceCodec.fromAttribute("blur").isUnspecified()).isTrue();
        assertThat(ReferenceCodec.fromAttribute("result").isUnspecified()).isTrue();
        assertThat(ReferenceCodec.fromAttribute("result-2").isUnspecified()).isTrue();
        assertThat(ReferenceCodec.fromAttribute("result99999999999").isUnspecified()).isTrue();
        assertThat(ReferenceCodec.fromAttribute("-1").isUnspecified()).isTrue();
    }

    @Test
    void formatsAttributes() {
        assertThat(ReferenceCodec.toAttribute(InputReference.namedResult(5))).isEqualTo("result5");
        assertThat(ReferenceCodec.toAttribute(InputReference.standardSource(StandardSource.FILL_PAINT)))
            .isEqualTo("FillPaint");
        assertThat(ReferenceCodec.toAttribute(InputReference.unspecified())).isNull();
    }

    @Test
    void unknownStandardIndexSurvivesAttributeRoundTrip() {
        InputReference beyond = InputReference.standardSource(StandardSource.count() + 3);

        String stored = ReferenceCodec.toAttribute(beyond);

        assertThat(stored).isEqualTo(Integer.toString(-(StandardSource.count() + 3) - 2));
        assertThat(ReferenceCodec.fromAttribute(stored)).isEqualTo(beyond);
    }

    @Test
    void outputIdNames() {
        assertThat(ReferenceCodec.parseOutputId("result12")).isEqualTo(12);
        assertThat(ReferenceCodec.parseOutputId("Result12")).isNull();
        assertThat(ReferenceCodec.parseOutputId("result1a")).isNull();
        assertThat(ReferenceCodec.formatOutputId(0)).isEqualTo("result0");
        assertThatThrownBy(() -> ReferenceCodec.formatOutputId(-1))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
