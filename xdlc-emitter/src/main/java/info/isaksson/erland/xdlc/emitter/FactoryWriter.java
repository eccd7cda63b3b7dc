package info.isaksson.erland.xdlc.emitter;

import info.isaksson.erland.xdlc.ast.Version;
import info.isaksson.erland.xdlc.render.CodeWriter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Runtime version dispatcher and its explicit-instantiation macro.
 *
 * <p>The dispatcher tests breakpoints from the newest down and constructs {@code T<v>} for the first one not
 * above the runtime version, falling back to the baseline {@code T<abi_t{}>}.</p>
 */
final class FactoryWriter {

    private FactoryWriter() {}

    static void write(CodeWriter w, String name, List<Version> breakpoints) {
        List<Version> thresholds = new ArrayList<>();
        for (Version v : breakpoints) {
            if (!Version.ZERO.equals(v)) thresholds.add(v);
        }
        List<Version> descending = new ArrayList<>(thresholds);
        Collections.reverse(descending);

        w.line("template<template<abi_t> typename T>");
        w.line("inline HRESULT " + name + "(abi_t ABI, void **ppvObject)");
        w.open();
        w.line("if (ppvObject == nullptr)");
        w.indent().line("return E_POINTER;").outdent();
        w.blank();

        if (descending.isEmpty()) {
            w.line("*ppvObject = new T<abi_t{}>();");
        } else {
            for (int i = 0; i < descending.size(); i++) {
                String literal = descending.get(i).toAbiLiteral();
                w.line((i > 0 ? "else " : "") + "if (ABI >= " + literal + ")");
                w.indent().line("*ppvObject = new T<" + literal + ">();").outdent();
            }
            w.line("else");
            w.indent().line("*ppvObject = new T<abi_t{}>();").outdent();
        }

        w.blank();
        w.line("return S_OK;");
        w.close();
        w.blank();

        List<String> instances = new ArrayList<>();
        instances.add("template class T<abi_t{}>");
        for (Version v : thresholds) {
            instances.add("template class T<" + v.toAbiLiteral() + ">");
        }
        w.directive("#define " + name + "_INSTANTIATE(T) \\");
        for (int i = 0; i < instances.size(); i++) {
            boolean last = i == instances.size() - 1;
            w.directive("    " + instances.get(i) + (last ? "" : "; \\"));
        }
    }
}
