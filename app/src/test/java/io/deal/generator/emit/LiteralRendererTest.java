package io.deal.generator.emit;

import com.google.protobuf.ByteString;
import com.google.protobuf.Descriptors.Descriptor;
import com.google.protobuf.Descriptors.EnumDescriptor;
import com.google.protobuf.Descriptors.FieldDescriptor;
import com.google.protobuf.Descriptors.FileDescriptor;
import io.deal.generator.TestSchemas;
import io.deal.generator.resolve.EnumValue;
import io.deal.generator.resolve.RepeatedValue;
import io.deal.generator.resolve.ResolvedField;
import io.deal.generator.resolve.ResolvedMessage;
import io.deal.generator.resolve.ScalarValue;
import io.deal.generator.resolve.ValueResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LiteralRendererTest {

    private LiteralRenderer renderer;
    private ValueResolver resolver;
    private FileDescriptor catalog;

    @BeforeEach
    void setUp() {
        renderer = new LiteralRenderer();
        resolver = new ValueResolver();
        catalog = TestSchemas.catalogFile();
    }

    @Test
    @DisplayName("Should render a builder chain over the generated message class")
    void shouldRenderBuilder() throws Exception {
        Descriptor myRequest = TestSchemas.myServiceFile().findMessageTypeByName("MyRequest");
        ResolvedMessage request = resolver.resolve(TestSchemas.json("{\"requestField\": \"VALUE\"}"), myRequest, "here");

        String literal = renderer.message(request).toString();

        assertThat(literal)
            .startsWith("io.deal.example.MyRequest.newBuilder()")
            .contains(".setRequestField(\"VALUE\")")
            .endsWith(".build()");
    }

    @Test
    @DisplayName("Should render an empty message as the default instance")
    void shouldRenderDefaultInstance() throws Exception {
        ResolvedMessage empty = resolver.resolve(TestSchemas.json("{}"), catalog.findMessageTypeByName("Item"), "here");

        assertThat(renderer.message(empty).toString()).isEqualTo("deal.catalog.Catalog.Item.getDefaultInstance()");
    }

    @Test
    @DisplayName("Should render every kind of field")
    void shouldRenderAllKinds() throws Exception {
        ResolvedMessage book = resolver.resolve(TestSchemas.json("""
            {
              "id": "book-1",
              "tags": ["fiction", "classic"],
              "attributes": {"pages": 320},
              "kind": "KIND_BOOK",
              "price": 12.5,
              "payload": "AQID",
              "active": true,
              "parent": {"id": "shelf-7"}
            }
            """), catalog.findMessageTypeByName("Item"), "here");

        String literal = renderer.message(book).toString();

        assertThat(literal)
            .contains(".setId(\"book-1\")")
            .contains(".addTags(\"fiction\")")
            .contains(".addTags(\"classic\")")
            .contains(".putAttributes(\"pages\", 320)")
            .contains(".setKind(deal.catalog.CatalogTypes.Kind.KIND_BOOK)")
            .contains(".setPrice(12.5)")
            .contains(".setPayload(com.google.protobuf.ByteString.copyFrom(java.util.Base64.getDecoder().decode(\"AQID\")))")
            .contains(".setActive(true)")
            .contains(".setParent(deal.catalog.CatalogTypes.ItemRef.newBuilder()")
            .contains(".setId(\"shelf-7\")");
        assertThat(literal.indexOf("addTags(\"fiction\")")).isLessThan(literal.indexOf("addTags(\"classic\")"));
        assertThat(literal.indexOf("setId(\"book-1\")")).isLessThan(literal.indexOf("setActive"));
    }

    @Test
    @DisplayName("Should render numeric literals with their Java suffixes")
    void shouldRenderNumericLiterals() {
        assertThat(renderer.expression(new ScalarValue(FieldDescriptor.JavaType.INT, -7)).toString()).isEqualTo("-7");
        assertThat(renderer.expression(new ScalarValue(FieldDescriptor.JavaType.LONG, 42L)).toString()).isEqualTo("42L");
        assertThat(renderer.expression(new ScalarValue(FieldDescriptor.JavaType.FLOAT, 1.5f)).toString()).isEqualTo("1.5f");
        assertThat(renderer.expression(new ScalarValue(FieldDescriptor.JavaType.DOUBLE, 2.25)).toString()).isEqualTo("2.25");
        assertThat(renderer.expression(new ScalarValue(FieldDescriptor.JavaType.FLOAT, Float.NaN)).toString())
            .isEqualTo("java.lang.Float.NaN");
        assertThat(renderer.expression(new ScalarValue(FieldDescriptor.JavaType.DOUBLE, Double.NEGATIVE_INFINITY)).toString())
            .isEqualTo("java.lang.Double.NEGATIVE_INFINITY");
        assertThat(renderer.expression(new ScalarValue(FieldDescriptor.JavaType.BYTE_STRING, ByteString.EMPTY)).toString())
            .isEqualTo("com.google.protobuf.ByteString.EMPTY");
    }

    @Test
    @DisplayName("Should escape string literals")
    void shouldEscapeStrings() {
        assertThat(renderer.expression(new ScalarValue(FieldDescriptor.JavaType.STRING, "say \"hi\"\n")).toString())
            .isEqualTo("\"say \\\"hi\\\"\\n\"");
    }

    @Test
    @DisplayName("Should set unrecognized enum numbers through the value accessor")
    void shouldRenderUnrecognizedEnum() {
        Descriptor item = catalog.findMessageTypeByName("Item");
        FieldDescriptor kind = item.findFieldByName("kind");
        EnumDescriptor kindType = kind.getEnumType();
        EnumValue unknown = new EnumValue(kindType.findValueByNumberCreatingIfUnknown(9));

        String literal = renderer.message(new ResolvedMessage(item, List.of(new ResolvedField(kind, unknown)))).toString();

        assertThat(unknown.isUnrecognizedEnum()).isTrue();
        assertThat(literal).contains(".setKindValue(9)");
    }

    @Test
    @DisplayName("Should call the builder methods protoc renames")
    void shouldRenderRenamedAccessors() throws Exception {
        Descriptor pageRequest = TestSchemas.pagingFile().findMessageTypeByName("PageRequest");
        ResolvedMessage request = resolver.resolve(TestSchemas.json("""
            {
              "class": "c",
              "itemsCount": 2,
              "items": ["x"],
              "cachedSize": "s",
              "shelves": ["SHELF_TOP"]
            }
            """), pageRequest, "here");
        FieldDescriptor shelves = pageRequest.findFieldByName("shelves");
        EnumValue unknownShelf = new EnumValue(shelves.getEnumType().findValueByNumberCreatingIfUnknown(7));

        String literal = renderer.message(request).toString();
        String unknownLiteral = renderer.message(new ResolvedMessage(pageRequest,
            List.of(new ResolvedField(shelves, new RepeatedValue(List.of(unknownShelf)))))).toString();

        assertThat(literal)
            .contains(".setClass_(\"c\")")
            .contains(".setItemsCount2(2)")
            .contains(".addItems3(\"x\")")
            .contains(".setCachedSize_(\"s\")")
            .contains(".addShelves5(io.deal.paging.Shelf.SHELF_TOP)");
        assertThat(unknownLiteral).contains(".addShelves5Value(7)");
    }
}
