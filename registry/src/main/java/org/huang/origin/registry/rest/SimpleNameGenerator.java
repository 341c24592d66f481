package org.huang.origin.registry.rest;

import java.security.SecureRandom;
import java.util.Random;

/**
 * base 后面追加 5 个随机字符，必要时截断 base，保证结果不超过 63 个字符。
 * 字符表里去掉了元音和容易混淆的字符，避免拼出有含义的单词。
 */
public class SimpleNameGenerator implements NameGenerator {

    public static final SimpleNameGenerator INSTANCE = new SimpleNameGenerator();

    static final int MAX_NAME_LENGTH = 63;
    static final int RANDOM_LENGTH = 5;
    static final int MAX_GENERATED_NAME_LENGTH = MAX_NAME_LENGTH - RANDOM_LENGTH;
    static final String ALPHANUMS = "bcdfghjklmnpqrstvwxz2456789";

    private final Random random;

    public SimpleNameGenerator() {
        this(new SecureRandom());
    }

    public SimpleNameGenerator(Random random) {
        this.random = random;
    }

    @Override
    public String generateName(String base) {
        if (base.length() > MAX_GENERATED_NAME_LENGTH) {
            base = base.substring(0, MAX_GENERATED_NAME_LENGTH);
        }
        StringBuilder sb = new StringBuilder(base);
        for (int i = 0; i < RANDOM_LENGTH; i++) {
            sb.append(ALPHANUMS.charAt(random.nextInt(ALPHANUMS.length())));
        }
        return sb.toString();
    }
}
