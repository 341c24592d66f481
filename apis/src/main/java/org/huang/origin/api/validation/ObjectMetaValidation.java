package org.huang.origin.api.validation;

import io.fabric8.kubernetes.api.model.ObjectMeta;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 所有资源通用的 metadata 校验
 */
public final class ObjectMetaValidation {

    public static final String FIELD_IMMUTABLE = "field is immutable";

    private ObjectMetaValidation() {
    }

    public static List<FieldError> validateObjectMeta(ObjectMeta meta, boolean requiresNamespace,
                                                      FieldPath path) {
        List<FieldError> errors = new ArrayList<>();
        if (meta == null) {
            errors.add(FieldError.required(path, ""));
            return errors;
        }
        String name = meta.getName();
        if (isEmpty(name)) {
            if (isEmpty(meta.getGenerateName())) {
                errors.add(FieldError.required(path.child("name"), "name or generateName is required"));
            }
        } else if (!NameValidation.isDns1123Subdomain(name)) {
            errors.add(FieldError.invalid(path.child("name"), name, NameValidation.DNS1123_SUBDOMAIN_MESSAGE));
        }

        String namespace = meta.getNamespace();
        if (requiresNamespace) {
            if (isEmpty(namespace)) {
                errors.add(FieldError.required(path.child("namespace"), ""));
            } else if (!NameValidation.isDns1123Label(namespace)) {
                errors.add(FieldError.invalid(path.child("namespace"), namespace,
                        NameValidation.DNS1123_LABEL_MESSAGE));
            }
        } else if (!isEmpty(namespace)) {
            errors.add(FieldError.forbidden(path.child("namespace"), "not allowed on this type"));
        }
        return errors;
    }

    /**
     * 更新时 name / namespace 不可修改
     */
    public static List<FieldError> validateObjectMetaUpdate(ObjectMeta meta, ObjectMeta old, FieldPath path) {
        List<FieldError> errors = new ArrayList<>();
        if (meta == null || old == null) {
            errors.add(FieldError.required(path, ""));
            return errors;
        }
        if (!Objects.equals(meta.getName(), old.getName())) {
            errors.add(FieldError.invalid(path.child("name"), meta.getName(), FIELD_IMMUTABLE));
        }
        if (!Objects.equals(meta.getNamespace(), old.getNamespace())) {
            errors.add(FieldError.invalid(path.child("namespace"), meta.getNamespace(), FIELD_IMMUTABLE));
        }
        return errors;
    }

    static boolean isEmpty(String s) {
        return s == null || s.isEmpty();
    }
}
