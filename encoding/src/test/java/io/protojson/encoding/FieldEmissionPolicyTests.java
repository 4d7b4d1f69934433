package io.protojson.encoding;

import static org.junit.jupiter.api.Assertions.*;

import static io.protojson.encoding.TestSchemas.*;

import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import com.google.protobuf.DynamicMessage;

class FieldEmissionPolicyTests {
    @Test
    void testSelectPopulatedOnly() {
        final DynamicMessage message = newBuilder(SCALARS)
                                               .setField(field(SCALARS, "opt_string"), "x")
                                               .setField(field(SCALARS, "opt_int32"), 3)
                                               .build();
        final List<FieldEmissionPolicy.EmittedField> emitted = new FieldEmissionPolicy(EncoderOptions.defaults()).select(message);
        assertEquals(List.of("optInt32", "optString"), emitted.stream().map(FieldEmissionPolicy.EmittedField::getName).collect(Collectors.toList()));
        assertEquals(3, emitted.get(0).getValue());
        assertSame(field(SCALARS, "opt_string"), emitted.get(1).getDescriptor());
    }

    @Test
    void testUnpopulatedValues() {
        final FieldEmissionPolicy policy = new FieldEmissionPolicy(EncoderOptions.newBuilder().setEmitUnpopulated(true).build());
        final List<FieldEmissionPolicy.EmittedField> emitted = policy.select(newBuilder(SCALARS2).build());
        assertEquals(7, emitted.size());
        assertNull(emitted.get(0).getValue(), "proto2 scalar");
        assertEquals(List.of(), emitted.get(3).getValue(), "repeated");

        final List<FieldEmissionPolicy.EmittedField> proto3 = policy.select(newBuilder(NESTED).build());
        assertEquals("", proto3.get(0).getValue());
    }

    @Test
    void testNullRendering() {
        assertTrue(FieldEmissionPolicy.rendersUnpopulatedAsNull(field(SCALARS, "opt_nested")));
        assertTrue(FieldEmissionPolicy.rendersUnpopulatedAsNull(field(SCALARS2, "opt_int32")));
        assertTrue(FieldEmissionPolicy.rendersUnpopulatedAsNull(field(SCALARS2, "mygroup")));
        assertFalse(FieldEmissionPolicy.rendersUnpopulatedAsNull(field(SCALARS, "opt_int32")));
        assertFalse(FieldEmissionPolicy.rendersUnpopulatedAsNull(field(SCALARS, "rpt_nested")));
        assertFalse(FieldEmissionPolicy.rendersUnpopulatedAsNull(field(SCALARS, "str_to_int")));
    }

    @Test
    void testFieldNames() {
        final FieldEmissionPolicy json = new FieldEmissionPolicy(EncoderOptions.defaults());
        final FieldEmissionPolicy proto = new FieldEmissionPolicy(EncoderOptions.newBuilder().setUseProtoNames(true).build());
        assertEquals("optInt64Wrapper", json.getFieldName(field(SCALARS, "opt_int64_wrapper")));
        assertEquals("opt_int64_wrapper", proto.getFieldName(field(SCALARS, "opt_int64_wrapper")));
        assertEquals("MyGroup", json.getFieldName(field(SCALARS2, "mygroup")));
        assertEquals("MyGroup", proto.getFieldName(field(SCALARS2, "mygroup")));
    }
}
