module io.github.cyfko.odatafilter.core {
    requires java.logging;

    exports io.github.cyfko.odatafilter.core;
    exports io.github.cyfko.odatafilter.core.api;
    exports io.github.cyfko.odatafilter.core.config;
    exports io.github.cyfko.odatafilter.core.edm;
    exports io.github.cyfko.odatafilter.core.exception;
    exports io.github.cyfko.odatafilter.core.impl;
    exports io.github.cyfko.odatafilter.core.model;
    exports io.github.cyfko.odatafilter.core.parsing;
    exports io.github.cyfko.odatafilter.core.printing;
    exports io.github.cyfko.odatafilter.core.tree;
    exports io.github.cyfko.odatafilter.core.utils;
}
