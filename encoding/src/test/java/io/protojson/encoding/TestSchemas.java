package io.protojson.encoding;

import java.util.Objects;

import com.google.protobuf.AnyProto;
import com.google.protobuf.DescriptorProtos.DescriptorProto;
import com.google.protobuf.DescriptorProtos.EnumDescriptorProto;
import com.google.protobuf.DescriptorProtos.EnumValueDescriptorProto;
import com.google.protobuf.DescriptorProtos.FieldDescriptorProto;
import com.google.protobuf.DescriptorProtos.FieldDescriptorProto.Label;
import com.google.protobuf.DescriptorProtos.FieldDescriptorProto.Type;
import com.google.protobuf.DescriptorProtos.FileDescriptorProto;
import com.google.protobuf.DescriptorProtos.MessageOptions;
import com.google.protobuf.DescriptorProtos.OneofDescriptorProto;
import com.google.protobuf.Descriptors.Descriptor;
import com.google.protobuf.Descriptors.DescriptorValidationException;
import com.google.protobuf.Descriptors.FieldDescriptor;
import com.google.protobuf.Descriptors.FileDescriptor;
import com.google.protobuf.DurationProto;
import com.google.protobuf.DynamicMessage;
import com.google.protobuf.EmptyProto;
import com.google.protobuf.FieldMaskProto;
import com.google.protobuf.StructProto;
import com.google.protobuf.TimestampProto;
import com.google.protobuf.WrappersProto;

/**
 * Test schemas assembled from descriptor protos, equivalent to:
 *
 * <pre>
 * // protojson/test3.proto
 * syntax = "proto3";
 * package protojson.test3;
 * enum Color { COLOR_UNSPECIFIED = 0; RED = 1; GREEN = 2; }
 * message Nested { string name = 1; repeated string tags = 2; }
 * message Node { Node child = 1; int32 value = 2; }
 * message Scalars {
 *   bool opt_bool = 1; int32 opt_int32 = 2; int64 opt_int64 = 3; uint32 opt_uint32 = 4; uint64 opt_uint64 = 5;
 *   sint32 opt_sint32 = 6; sint64 opt_sint64 = 7; fixed32 opt_fixed32 = 8; fixed64 opt_fixed64 = 9;
 *   sfixed32 opt_sfixed32 = 10; sfixed64 opt_sfixed64 = 11; float opt_float = 12; double opt_double = 13;
 *   bytes opt_bytes = 14; string opt_string = 15; Color opt_enum = 16; Nested opt_nested = 17;
 *   repeated int64 rpt_int64 = 18; repeated string rpt_string = 19; repeated Color rpt_enum = 20;
 *   repeated Nested rpt_nested = 21;
 *   map&lt;string, int32&gt; str_to_int = 22; map&lt;int64, string&gt; int_to_str = 23;
 *   map&lt;uint32, string&gt; uint_to_str = 24; map&lt;bool, Nested&gt; bool_to_nested = 25;
 *   oneof union { string oneof_string = 26; Nested oneof_nested = 27; }
 *   optional string maybe = 28;
 *   google.protobuf.NullValue opt_null = 29; google.protobuf.Timestamp opt_timestamp = 30;
 *   google.protobuf.Duration opt_duration = 31; google.protobuf.Any opt_any = 32; google.protobuf.Value opt_value = 33;
 *   google.protobuf.Int64Value opt_int64_wrapper = 34; google.protobuf.FieldMask opt_field_mask = 35;
 *   google.protobuf.Struct opt_struct = 36; google.protobuf.Empty opt_empty = 37;
 *   map&lt;fixed64, string&gt; fixed64_to_str = 38;
 * }
 *
 * // protojson/test2.proto
 * syntax = "proto2";
 * package protojson.test2;
 * enum Color2 { ONE = 1; TWO = 2; }
 * message Nested2 { optional string name = 1; }
 * message Scalars2 {
 *   optional int32 opt_int32 = 1; optional string opt_string = 2 [default = "hello"];
 *   optional Nested2 opt_nested = 3; repeated int32 rpt_int32 = 4;
 *   optional group MyGroup = 5 { optional int32 a = 1; }
 *   optional Color2 opt_enum = 6; map&lt;string, string&gt; labels = 7;
 * }
 * message Required2 { required string name = 1; optional Required2 child = 2; }
 * message Extendable2 { optional int32 base = 1; extensions 100 to 199; }
 * message ExtScope { extend Extendable2 { optional Nested2 scoped_nested = 102; } }
 * extend Extendable2 { optional int64 ext_int64 = 100; optional string ext_string = 101; repeated int32 ext_rpt = 103; }
 * message LegacySet { option message_set_wire_format = true; extensions 4 to max; }
 * message LegacyItem { optional string text = 1; extend LegacySet { optional LegacyItem message_set_extension = 1000; } }
 * </pre>
 */
final class TestSchemas {
    static final String PACKAGE3 = "protojson.test3";
    static final String PACKAGE2 = "protojson.test2";
    static final FileDescriptor PROTO3_FILE = buildProto3();
    static final FileDescriptor PROTO2_FILE = buildProto2();

    static final Descriptor NESTED = PROTO3_FILE.findMessageTypeByName("Nested");
    static final Descriptor NODE = PROTO3_FILE.findMessageTypeByName("Node");
    static final Descriptor SCALARS = PROTO3_FILE.findMessageTypeByName("Scalars");
    static final Descriptor NESTED2 = PROTO2_FILE.findMessageTypeByName("Nested2");
    static final Descriptor SCALARS2 = PROTO2_FILE.findMessageTypeByName("Scalars2");
    static final Descriptor REQUIRED2 = PROTO2_FILE.findMessageTypeByName("Required2");
    static final Descriptor EXTENDABLE2 = PROTO2_FILE.findMessageTypeByName("Extendable2");
    static final Descriptor EXT_SCOPE = PROTO2_FILE.findMessageTypeByName("ExtScope");
    static final Descriptor LEGACY_SET = PROTO2_FILE.findMessageTypeByName("LegacySet");
    static final Descriptor LEGACY_ITEM = PROTO2_FILE.findMessageTypeByName("LegacyItem");

    static final FieldDescriptor EXT_INT64 = PROTO2_FILE.findExtensionByName("ext_int64");
    static final FieldDescriptor EXT_STRING = PROTO2_FILE.findExtensionByName("ext_string");
    static final FieldDescriptor EXT_RPT = PROTO2_FILE.findExtensionByName("ext_rpt");
    static final FieldDescriptor SCOPED_NESTED = EXT_SCOPE.findExtensionByName("scoped_nested");
    static final FieldDescriptor MESSAGE_SET_EXTENSION = LEGACY_ITEM.findExtensionByName("message_set_extension");

    private TestSchemas() {
        // utility class
    }

    static FieldDescriptor field(final Descriptor descriptor, final String name) {
        return Objects.requireNonNull(descriptor.findFieldByName(name), () -> descriptor.getFullName() + " has no field " + name);
    }

    static DynamicMessage.Builder newBuilder(final Descriptor descriptor) {
        return DynamicMessage.newBuilder(descriptor);
    }

    static DynamicMessage nested(final String name, final String... tags) {
        final DynamicMessage.Builder builder = newBuilder(NESTED).setField(field(NESTED, "name"), name);
        for (final String tag : tags) {
            builder.addRepeatedField(field(NESTED, "tags"), tag);
        }
        return builder.build();
    }

    static DynamicMessage mapEntry(final FieldDescriptor mapField, final Object key, final Object value) {
        final Descriptor entryType = mapField.getMessageType();
        return DynamicMessage.newBuilder(entryType).setField(entryType.findFieldByNumber(1), key).setField(entryType.findFieldByNumber(2), value).build();
    }

    private static FileDescriptor buildProto3() {
        final String color = '.' + PACKAGE3 + ".Color";
        final String nested = '.' + PACKAGE3 + ".Nested";
        final String scalars = '.' + PACKAGE3 + ".Scalars";
        final DescriptorProto.Builder scalarsType = DescriptorProto.newBuilder().setName("Scalars")
                                                            .addField(optional("opt_bool", 1, Type.TYPE_BOOL))
                                                            .addField(optional("opt_int32", 2, Type.TYPE_INT32))
                                                            .addField(optional("opt_int64", 3, Type.TYPE_INT64))
                                                            .addField(optional("opt_uint32", 4, Type.TYPE_UINT32))
                                                            .addField(optional("opt_uint64", 5, Type.TYPE_UINT64))
                                                            .addField(optional("opt_sint32", 6, Type.TYPE_SINT32))
                                                            .addField(optional("opt_sint64", 7, Type.TYPE_SINT64))
                                                            .addField(optional("opt_fixed32", 8, Type.TYPE_FIXED32))
                                                            .addField(optional("opt_fixed64", 9, Type.TYPE_FIXED64))
                                                            .addField(optional("opt_sfixed32", 10, Type.TYPE_SFIXED32))
                                                            .addField(optional("opt_sfixed64", 11, Type.TYPE_SFIXED64))
                                                            .addField(optional("opt_float", 12, Type.TYPE_FLOAT))
                                                            .addField(optional("opt_double", 13, Type.TYPE_DOUBLE))
                                                            .addField(optional("opt_bytes", 14, Type.TYPE_BYTES))
                                                            .addField(optional("opt_string", 15, Type.TYPE_STRING))
                                                            .addField(typed("opt_enum", 16, Label.LABEL_OPTIONAL, Type.TYPE_ENUM, color))
                                                            .addField(typed("opt_nested", 17, Label.LABEL_OPTIONAL, Type.TYPE_MESSAGE, nested))
                                                            .addField(repeated("rpt_int64", 18, Type.TYPE_INT64))
                                                            .addField(repeated("rpt_string", 19, Type.TYPE_STRING))
                                                            .addField(typed("rpt_enum", 20, Label.LABEL_REPEATED, Type.TYPE_ENUM, color))
                                                            .addField(typed("rpt_nested", 21, Label.LABEL_REPEATED, Type.TYPE_MESSAGE, nested))
                                                            .addField(typed("str_to_int", 22, Label.LABEL_REPEATED, Type.TYPE_MESSAGE, scalars + ".StrToIntEntry"))
                                                            .addNestedType(mapEntry("StrToIntEntry", Type.TYPE_STRING, Type.TYPE_INT32, null))
                                                            .addField(typed("int_to_str", 23, Label.LABEL_REPEATED, Type.TYPE_MESSAGE, scalars + ".IntToStrEntry"))
                                                            .addNestedType(mapEntry("IntToStrEntry", Type.TYPE_INT64, Type.TYPE_STRING, null))
                                                            .addField(typed("uint_to_str", 24, Label.LABEL_REPEATED, Type.TYPE_MESSAGE, scalars + ".UintToStrEntry"))
                                                            .addNestedType(mapEntry("UintToStrEntry", Type.TYPE_UINT32, Type.TYPE_STRING, null))
                                                            .addField(typed("bool_to_nested", 25, Label.LABEL_REPEATED, Type.TYPE_MESSAGE, scalars + ".BoolToNestedEntry"))
                                                            .addNestedType(mapEntry("BoolToNestedEntry", Type.TYPE_BOOL, Type.TYPE_MESSAGE, nested))
                                                            .addOneofDecl(OneofDescriptorProto.newBuilder().setName("union"))
                                                            .addField(optional("oneof_string", 26, Type.TYPE_STRING).toBuilder().setOneofIndex(0))
                                                            .addField(typed("oneof_nested", 27, Label.LABEL_OPTIONAL, Type.TYPE_MESSAGE, nested).toBuilder().setOneofIndex(0))
                                                            .addOneofDecl(OneofDescriptorProto.newBuilder().setName("_maybe"))
                                                            .addField(optional("maybe", 28, Type.TYPE_STRING).toBuilder().setOneofIndex(1).setProto3Optional(true))
                                                            .addField(typed("opt_null", 29, Label.LABEL_OPTIONAL, Type.TYPE_ENUM, ".google.protobuf.NullValue"))
                                                            .addField(typed("opt_timestamp", 30, Label.LABEL_OPTIONAL, Type.TYPE_MESSAGE, ".google.protobuf.Timestamp"))
                                                            .addField(typed("opt_duration", 31, Label.LABEL_OPTIONAL, Type.TYPE_MESSAGE, ".google.protobuf.Duration"))
                                                            .addField(typed("opt_any", 32, Label.LABEL_OPTIONAL, Type.TYPE_MESSAGE, ".google.protobuf.Any"))
                                                            .addField(typed("opt_value", 33, Label.LABEL_OPTIONAL, Type.TYPE_MESSAGE, ".google.protobuf.Value"))
                                                            .addField(typed("opt_int64_wrapper", 34, Label.LABEL_OPTIONAL, Type.TYPE_MESSAGE, ".google.protobuf.Int64Value"))
                                                            .addField(typed("opt_field_mask", 35, Label.LABEL_OPTIONAL, Type.TYPE_MESSAGE, ".google.protobuf.FieldMask"))
                                                            .addField(typed("opt_struct", 36, Label.LABEL_OPTIONAL, Type.TYPE_MESSAGE, ".google.protobuf.Struct"))
                                                            .addField(typed("opt_empty", 37, Label.LABEL_OPTIONAL, Type.TYPE_MESSAGE, ".google.protobuf.Empty"))
                                                            .addField(typed("fixed64_to_str", 38, Label.LABEL_REPEATED, Type.TYPE_MESSAGE, scalars + ".Fixed64ToStrEntry"))
                                                            .addNestedType(mapEntry("Fixed64ToStrEntry", Type.TYPE_FIXED64, Type.TYPE_STRING, null));

        final FileDescriptorProto file = FileDescriptorProto.newBuilder()
                                                 .setName("protojson/test3.proto")
                                                 .setPackage(PACKAGE3)
                                                 .setSyntax("proto3")
                                                 .addDependency(StructProto.getDescriptor().getName())
                                                 .addDependency(TimestampProto.getDescriptor().getName())
                                                 .addDependency(DurationProto.getDescriptor().getName())
                                                 .addDependency(AnyProto.getDescriptor().getName())
                                                 .addDependency(WrappersProto.getDescriptor().getName())
                                                 .addDependency(FieldMaskProto.getDescriptor().getName())
                                                 .addDependency(EmptyProto.getDescriptor().getName())
                                                 .addEnumType(EnumDescriptorProto.newBuilder().setName("Color").addValue(enumValue("COLOR_UNSPECIFIED", 0)).addValue(enumValue("RED", 1)).addValue(enumValue("GREEN", 2)))
                                                 .addMessageType(DescriptorProto.newBuilder().setName("Nested").addField(optional("name", 1, Type.TYPE_STRING)).addField(repeated("tags", 2, Type.TYPE_STRING)))
                                                 .addMessageType(DescriptorProto.newBuilder().setName("Node").addField(typed("child", 1, Label.LABEL_OPTIONAL, Type.TYPE_MESSAGE, '.' + PACKAGE3 + ".Node")).addField(optional("value", 2, Type.TYPE_INT32)))
                                                 .addMessageType(scalarsType)
                                                 .build();
        return build(file, StructProto.getDescriptor(), TimestampProto.getDescriptor(), DurationProto.getDescriptor(), AnyProto.getDescriptor(), WrappersProto.getDescriptor(),
                FieldMaskProto.getDescriptor(), EmptyProto.getDescriptor());
    }

    private static FileDescriptor buildProto2() {
        final String extendable = '.' + PACKAGE2 + ".Extendable2";
        final String nested2 = '.' + PACKAGE2 + ".Nested2";
        final DescriptorProto.Builder scalarsType = DescriptorProto.newBuilder().setName("Scalars2")
                                                            .addField(optional("opt_int32", 1, Type.TYPE_INT32))
                                                            .addField(optional("opt_string", 2, Type.TYPE_STRING).toBuilder().setDefaultValue("hello"))
                                                            .addField(typed("opt_nested", 3, Label.LABEL_OPTIONAL, Type.TYPE_MESSAGE, nested2))
                                                            .addField(repeated("rpt_int32", 4, Type.TYPE_INT32))
                                                            .addField(typed("mygroup", 5, Label.LABEL_OPTIONAL, Type.TYPE_GROUP, '.' + PACKAGE2 + ".Scalars2.MyGroup"))
                                                            .addNestedType(DescriptorProto.newBuilder().setName("MyGroup").addField(optional("a", 1, Type.TYPE_INT32)))
                                                            .addField(typed("opt_enum", 6, Label.LABEL_OPTIONAL, Type.TYPE_ENUM, '.' + PACKAGE2 + ".Color2"))
                                                            .addField(typed("labels", 7, Label.LABEL_REPEATED, Type.TYPE_MESSAGE, '.' + PACKAGE2 + ".Scalars2.LabelsEntry"))
                                                            .addNestedType(mapEntry("LabelsEntry", Type.TYPE_STRING, Type.TYPE_STRING, null));

        final FileDescriptorProto file = FileDescriptorProto.newBuilder()
                                                 .setName("protojson/test2.proto")
                                                 .setPackage(PACKAGE2)
                                                 .setSyntax("proto2")
                                                 .addEnumType(EnumDescriptorProto.newBuilder().setName("Color2").addValue(enumValue("ONE", 1)).addValue(enumValue("TWO", 2)))
                                                 .addMessageType(DescriptorProto.newBuilder().setName("Nested2").addField(optional("name", 1, Type.TYPE_STRING)))
                                                 .addMessageType(scalarsType)
                                                 .addMessageType(DescriptorProto.newBuilder()
                                                                         .setName("Required2")
                                                                         .addField(typed("name", 1, Label.LABEL_REQUIRED, Type.TYPE_STRING, null))
                                                                         .addField(typed("child", 2, Label.LABEL_OPTIONAL, Type.TYPE_MESSAGE, '.' + PACKAGE2 + ".Required2")))
                                                 .addMessageType(DescriptorProto.newBuilder()
                                                                         .setName("Extendable2")
                                                                         .addField(optional("base", 1, Type.TYPE_INT32))
                                                                         .addExtensionRange(DescriptorProto.ExtensionRange.newBuilder().setStart(100).setEnd(200)))
                                                 .addMessageType(DescriptorProto.newBuilder()
                                                                         .setName("ExtScope")
                                                                         .addExtension(typed("scoped_nested", 102, Label.LABEL_OPTIONAL, Type.TYPE_MESSAGE, nested2).toBuilder().setExtendee(extendable)))
                                                 .addMessageType(DescriptorProto.newBuilder()
                                                                         .setName("LegacySet")
                                                                         .setOptions(MessageOptions.newBuilder().setMessageSetWireFormat(true))
                                                                         .addExtensionRange(DescriptorProto.ExtensionRange.newBuilder().setStart(4).setEnd(536_870_912)))
                                                 .addMessageType(DescriptorProto.newBuilder()
                                                                         .setName("LegacyItem")
                                                                         .addField(optional("text", 1, Type.TYPE_STRING))
                                                                         .addExtension(typed("message_set_extension", 1000, Label.LABEL_OPTIONAL, Type.TYPE_MESSAGE, '.' + PACKAGE2 + ".LegacyItem")
                                                                                               .toBuilder()
                                                                                               .setExtendee('.' + PACKAGE2 + ".LegacySet")))
                                                 .addExtension(optional("ext_int64", 100, Type.TYPE_INT64).toBuilder().setExtendee(extendable))
                                                 .addExtension(optional("ext_string", 101, Type.TYPE_STRING).toBuilder().setExtendee(extendable))
                                                 .addExtension(repeated("ext_rpt", 103, Type.TYPE_INT32).toBuilder().setExtendee(extendable))
                                                 .build();
        return build(file);
    }

    private static FileDescriptor build(final FileDescriptorProto file, final FileDescriptor... dependencies) {
        try {
            return FileDescriptor.buildFrom(file, dependencies);
        } catch (DescriptorValidationException e) {
            throw new IllegalStateException("invalid test schema " + file.getName(), e);
        }
    }

    private static FieldDescriptorProto optional(final String name, final int number, final Type type) {
        return typed(name, number, Label.LABEL_OPTIONAL, type, null);
    }

    private static FieldDescriptorProto repeated(final String name, final int number, final Type type) {
        return typed(name, number, Label.LABEL_REPEATED, type, null);
    }

    private static FieldDescriptorProto typed(final String name, final int number, final Label label, final Type type, final String typeName) {
        final FieldDescriptorProto.Builder builder = FieldDescriptorProto.newBuilder().setName(name).setNumber(number).setLabel(label).setType(type);
        if (typeName != null) {
            builder.setTypeName(typeName);
        }
        return builder.build();
    }

    private static DescriptorProto mapEntry(final String name, final Type keyType, final Type valueType, final String valueTypeName) {
        return DescriptorProto.newBuilder()
                .setName(name)
                .setOptions(MessageOptions.newBuilder().setMapEntry(true))
                .addField(optional("key", 1, keyType))
                .addField(typed("value", 2, Label.LABEL_OPTIONAL, valueType, valueTypeName))
                .build();
    }

    private static EnumValueDescriptorProto enumValue(final String name, final int number) {
        return EnumValueDescriptorProto.newBuilder().setName(name).setNumber(number).build();
    }
}
