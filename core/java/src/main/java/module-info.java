module io.github.cyfko.kleene.core {
    requires java.logging;

    exports io.github.cyfko.kleene.core;
    exports io.github.cyfko.kleene.core.algebra;
    exports io.github.cyfko.kleene.core.api;
    exports io.github.cyfko.kleene.core.config;
    exports io.github.cyfko.kleene.core.exception;
    exports io.github.cyfko.kleene.core.impl;
    exports io.github.cyfko.kleene.core.model;
    exports io.github.cyfko.kleene.core.spi;
    exports io.github.cyfko.kleene.core.utils;
}
