package org.huang.origin.registry.rest;

/**
 * 根据 metadata.generateName 生成资源名称
 */
public interface NameGenerator {

    String generateName(String base);
}
