package org.huang.origin.api.validation;

import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class ObjectMetaValidationTest {

    private static final FieldPath METADATA = FieldPath.root("metadata");

    @Test
    void testValidMeta() {
        ObjectMeta meta = new ObjectMetaBuilder().withName("frontend").withNamespace("demo").build();
        assertThat(ObjectMetaValidation.validateObjectMeta(meta, true, METADATA)).isEmpty();
    }

    @Test
    void testNameOrGenerateNameRequired() {
        ObjectMeta meta = new ObjectMetaBuilder().withNamespace("demo").build();
        List<FieldError> errors = ObjectMetaValidation.validateObjectMeta(meta, true, METADATA);
        assertThat(errors).extracting(FieldError::getField).containsExactly("metadata.name");
        assertThat(errors.get(0).getType()).isEqualTo(ErrorType.REQUIRED);

        meta.setGenerateName("frontend-");
        assertThat(ObjectMetaValidation.validateObjectMeta(meta, true, METADATA)).isEmpty();
    }

    @Test
    void testInvalidNameAndMissingNamespace() {
        ObjectMeta meta = new ObjectMetaBuilder().withName("Front_End").build();
        List<FieldError> errors = ObjectMetaValidation.validateObjectMeta(meta, true, METADATA);
        assertThat(errors).extracting(FieldError::getField)
                .containsExactly("metadata.name", "metadata.namespace");
    }

    @Test
    void testNamespaceForbiddenForClusterScoped() {
        ObjectMeta meta = new ObjectMetaBuilder().withName("frontend").withNamespace("demo").build();
        assertThat(ObjectMetaValidation.validateObjectMeta(meta, false, METADATA))
                .extracting(FieldError::getType).containsExactly(ErrorType.FORBIDDEN);
    }

    @Test
    void testNameAndNamespaceImmutable() {
        ObjectMeta old = new ObjectMetaBuilder().withName("frontend").withNamespace("demo").build();
        ObjectMeta renamed = new ObjectMetaBuilder().withName("backend").withNamespace("other").build();
        List<FieldError> errors = ObjectMetaValidation.validateObjectMetaUpdate(renamed, old, METADATA);
        assertThat(errors).extracting(FieldError::getDetail)
                .containsOnly(ObjectMetaValidation.FIELD_IMMUTABLE);
        assertThat(errors).hasSize(2);
    }
}
