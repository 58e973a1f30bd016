package io.forthic.token;

public enum TokenType {
    STRING,
    COMMENT,
    START_ARRAY,
    END_ARRAY,
    START_MODULE,
    END_MODULE,
    START_DEF,
    END_DEF,
    START_MEMO,
    WORD,
    DOT_SYMBOL,
    EOS
}
