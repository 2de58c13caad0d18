module io.github.cyfko.wilkinson.core {
    requires java.logging;

    exports io.github.cyfko.wilkinson.core;
    exports io.github.cyfko.wilkinson.core.api;
    exports io.github.cyfko.wilkinson.core.ast;
    exports io.github.cyfko.wilkinson.core.cache;
    exports io.github.cyfko.wilkinson.core.config;
    exports io.github.cyfko.wilkinson.core.exception;
    exports io.github.cyfko.wilkinson.core.impl;
    exports io.github.cyfko.wilkinson.core.lexer;
    exports io.github.cyfko.wilkinson.core.model;
    exports io.github.cyfko.wilkinson.core.parsing;
    exports io.github.cyfko.wilkinson.core.semantic;
}
