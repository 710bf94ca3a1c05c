/*
 * SPDX-FileCopyrightText: 2026 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.stanio.svgscene.svg;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.xml.sax.InputSource;

import io.github.stanio.svgscene.geom.Transform;
import io.github.stanio.svgscene.markup.DomMarkup;
import io.github.stanio.svgscene.markup.MarkupElement;
import io.github.stanio.svgscene.markup.MarkupException;
import io.github.stanio.svgscene.scene.Group;

/**
 * Compiles SVG documents into scene graphs.
 * <pre>
 * <code>Group scene = new SVGParser().parse(Path.of("icon.svg"));</code></pre>
 * <p>
 * Problems with individual elements don't fail the compilation: the
 * element is left out, and the problem gets logged and reported to the
 * {@linkplain Builder#diagnostics(Consumer) diagnostics listener}, if
 * any.</p>
 * <p>
 * Instances are immutable and may be shared between threads.</p>
 */
public class SVGParser {

    private static final Logger log = Logger.getLogger(SVGParser.class.getName());

    private final Transform initialPosition;
    private final SceneDefaults defaults;
    private final TextMeasure textMeasure;
    private final Consumer<? super Diagnostic> listener;

    public SVGParser() {
        this(builder());
    }

    SVGParser(Builder builder) {
        this.initialPosition = builder.initialPosition;
        this.defaults = builder.defaults;
        this.textMeasure = (builder.textMeasure == null)
                           ? TextMeasure.forName(defaults.textMeasure())
                           : builder.textMeasure;
        this.listener = builder.listener;
    }

    public static Builder builder() {
        return new Builder();
    }

    public SceneDefaults defaults() {
        return defaults;
    }

    /**
     * Compiles the given document text.
     *
     * @param   text  the complete SVG document text
     * @return  the root of the compiled scene
     * @throws  MarkupException  if the text is not well-formed XML
     */
    public Group parse(String text) throws MarkupException {
        return compile(DomMarkup.parse(Objects.requireNonNull(text, "null text")));
    }

    /**
     * Compiles the given document file.
     *
     * @param   file  the SVG document file
     * @return  the root of the compiled scene
     * @throws  NoSuchFileException  if the file doesn't exist
     * @throws  MarkupException  if the file content is not well-formed XML
     * @throws  IOException  if other I/O error occurs
     */
    public Group parse(Path file) throws IOException {
        log.log(Level.FINE, "Parsing {0}", file);
        try (InputStream stream = Files.newInputStream(file)) {
            InputSource source = new InputSource(stream);
            source.setSystemId(file.toUri().toString());
            return compile(DomMarkup.parse(source));
        }
    }

    /**
     * Compiles a bundled {@code .svg} resource.
     *
     * @see  #parse(ClassLoader, String, String)
     */
    public Group parse(ClassLoader loader, String name) throws IOException {
        return parse(loader, name, "svg");
    }

    /**
     * Compiles a bundled document resource.
     *
     * @param   loader  the class loader to look the resource up with
     * @param   name  the resource name, without extension
     * @param   ext  the resource name extension
     * @return  the root of the compiled scene
     * @throws  NoSuchFileException  if {@code name.ext} is not found
     * @throws  MarkupException  if the resource content is not well-formed
     * @throws  IOException  if other I/O error occurs
     */
    public Group parse(ClassLoader loader, String name, String ext)
            throws IOException {
        String resourceName = name + "." + ext;
        URL resource = loader.getResource(resourceName);
        if (resource == null) {
            throw new NoSuchFileException(resourceName);
        }

        log.log(Level.FINE, "Parsing {0}", resource);
        try (InputStream stream = resource.openStream()) {
            InputSource source = new InputSource(stream);
            source.setSystemId(resource.toString());
            return compile(DomMarkup.parse(source));
        }
    }

    /**
     * Compiles an already parsed markup tree.
     *
     * @param   root  the document root element
     * @return  the root of the compiled scene
     */
    public Group compile(MarkupElement root) {
        Objects.requireNonNull(root, "null root");
        return new SceneBuilder(defaults, textMeasure, new Diagnostics(listener))
                .build(root, initialPosition);
    }


    public static class Builder {

        Transform initialPosition = Transform.IDENTITY;
        SceneDefaults defaults = SceneDefaults.standard();
        TextMeasure textMeasure;
        Consumer<? super Diagnostic> listener;

        Builder() {
            // from SVGParser.builder()
        }

        /**
         * @param   place  the placement of the compiled root group
         */
        public Builder initialPosition(Transform place) {
            this.initialPosition = Objects.requireNonNull(place, "null place");
            return this;
        }

        public Builder defaults(SceneDefaults defaults) {
            this.defaults = Objects.requireNonNull(defaults, "null defaults");
            return this;
        }

        /**
         * Overrides the text measure named by the {@linkplain
         * SceneDefaults#textMeasure() defaults}.
         */
        public Builder textMeasure(TextMeasure measure) {
            this.textMeasure = measure;
            return this;
        }

        /**
         * @param   listener  receives the problems with individual
         *          elements, may be {@code null}
         */
        public Builder diagnostics(Consumer<? super Diagnostic> listener) {
            this.listener = listener;
            return this;
        }

        public SVGParser build() {
            return new SVGParser(this);
        }

    } // class Builder


} // class SVGParser
