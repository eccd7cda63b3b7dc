package info.isaksson.erland.xdlc.emitter;

import info.isaksson.erland.xdlc.ast.SemanticException;
import info.isaksson.erland.xdlc.io.XdlSourceLoader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class HeaderEmitterTest {

    private static final String BASE = """
            [no_uuid]
            interface IUnknown {
                HRESULT QueryInterface(const GUID &riid, void **ppv);
            };
            """;

    private static Path write(Path dir, String name, String text) throws Exception {
        Path p = dir.resolve(name);
        Files.writeString(p, text, StandardCharsets.UTF_8);
        return p;
    }

    private static EmissionResult emit(Path root, EmitterOptions options) {
        return new HeaderEmitter().emit(XdlSourceLoader.load(root), options);
    }

    private static int count(String haystack, String needle) {
        int n = 0;
        for (int i = haystack.indexOf(needle); i >= 0; i = haystack.indexOf(needle, i + 1)) n++;
        return n;
    }

    @Test
    void structFieldsSplitIntoTwoWindowsAtTheirBreakpoint(@TempDir Path dir) throws Exception {
        Path root = write(dir, "points.xdl", """
                namespace demo {
                    struct Point {
                        [removed(10,0,15063,0)] int oldX;
                        [added(10,0,15063,0)] int newX;
                    };
                }
                """);

        EmissionResult result = emit(root, EmitterOptions.defaults());

        assertEquals("points.g.h", result.headerFileName);
        assertEquals("""
                #pragma once
                #ifndef __points_g_h__
                #define __points_g_h__

                #include <xcom/base.h>

                namespace demo
                {
                    template<abi_t ABI>
                    struct Point;

                    template<abi_t ABI>
                    struct Point
                    {
                        int oldX;
                    };

                    template<abi_t ABI>
                    requires (ABI >= abi_t{10,0,15063,0})
                    struct Point<ABI>
                    {
                        int newX;
                    };
                }

                #endif // __points_g_h__
                """, result.headerText);
        assertEquals(List.of("10.0.15063.0"), result.breakpoints);
        assertFalse(result.hasStubs());
        assertNull(result.stubsFileName);
    }

    @Test
    void interfaceMethodsAndDispatchTableFollowTheCodeWindows(@TempDir Path dir) throws Exception {
        write(dir, "base.xdl", BASE);
        Path root = write(dir, "widgets.xdl", """
                import "base.xdl";
                namespace demo {
                    [uuid("12345678-9abc-def0-1234-56789abcdef0")]
                    interface IWidget : IUnknown {
                        [removed(10,0,22000,0)] HRESULT Old(int a);
                        [added(10,0,22000,0)] HRESULT New(int a, int b);
                    };
                }
                """);

        String h = emit(root, EmitterOptions.defaults()).headerText;

        assertTrue(h.contains("#include <xcom/base.h>\n\n#include \"base.g.h\"\n"), h);
        assertTrue(h.contains("""
                    template<abi_t ABI>
                    struct IWidget;

                    template<abi_t ABI>
                    struct IWidgetVtbl;
                """), h);
        assertTrue(h.contains("""
                    template<abi_t ABI>
                    struct IWidget : IUnknown
                    {
                        virtual HRESULT Old(int a) = 0;
                    };

                    template<abi_t ABI>
                    requires (ABI >= abi_t{10,0,22000,0})
                    struct IWidget<ABI> : IUnknown
                    {
                        virtual HRESULT New(int a, int b) = 0;
                    };
                """), h);
        assertTrue(h.contains("""
                    template<abi_t ABI>
                    struct IWidgetVtbl : IUnknownVtbl
                    {
                        HRESULT(*Old)(void *, int a);
                    };

                    template<abi_t ABI>
                    requires (ABI >= abi_t{10,0,22000,0})
                    struct IWidgetVtbl<ABI> : IUnknownVtbl
                    {
                        HRESULT(*New)(void *, int a, int b);
                    };
                """), h);
        assertTrue(h.contains("DECLARE_ABI_UUIDOF_HELPER(demo::IWidget, "
                + "0x12345678,0x9ABC,0xDEF0,0x12,0x34,0x56,0x78,0x9A,0xBC,0xDE,0xF0)\n"), h);
        assertEquals(1, count(h, "Old(int a)"));
        assertFalse(h.contains("QueryInterface"), "imported declarations are not re-emitted");
        assertFalse(h.contains("HiddenReturn"));
    }

    @Test
    void conditionalBasesGoThroughASynthesizedBaseType(@TempDir Path dir) throws Exception {
        Path root = write(dir, "classes.xdl", """
                struct OldBase { int a; };
                struct NewBase { int b; };
                class Widget : [removed(10,0,26100,0)] OldBase, [added(10,0,26100,0)] NewBase {
                    int value;
                };
                """);

        String h = emit(root, EmitterOptions.defaults()).headerText;

        assertTrue(h.contains("""
                namespace details
                {
                    template<abi_t ABI>
                    struct WidgetBase : OldBase {};

                    template<abi_t ABI>
                    requires (ABI >= abi_t{10,0,26100,0})
                    struct WidgetBase<ABI> : NewBase {};
                }

                template<abi_t ABI>
                class Widget : public details::WidgetBase<ABI>
                {
                public:
                    int value;
                };
                """), h);
        assertTrue(h.contains("struct OldBase\n{\n    int a;\n};\n"), h);
        assertEquals(1, count(h, "class Widget "));
        assertFalse(h.contains("public OldBase"));
    }

    @Test
    void factoryTestsBreakpointsNewestFirst(@TempDir Path dir) throws Exception {
        Path root = write(dir, "factory.xdl", """
                struct A { [added(6,2,9200,0)] int a; };
                struct B { [added(10,0,15063,0)] int b; };
                struct C { [removed(10,0,15063,0)] int c; [added(6,2,9200)] int d; };
                """);

        EmissionResult result = emit(root, EmitterOptions.defaults().withFactoryName("CreateThing"));

        assertEquals(List.of("6.2.9200.0", "10.0.15063.0"), result.breakpoints);
        assertTrue(result.headerText.endsWith("""
                template<template<abi_t> typename T>
                inline HRESULT CreateThing(abi_t ABI, void **ppvObject)
                {
                    if (ppvObject == nullptr)
                        return E_POINTER;

                    if (ABI >= abi_t{10,0,15063,0})
                        *ppvObject = new T<abi_t{10,0,15063,0}>();
                    else if (ABI >= abi_t{6,2,9200,0})
                        *ppvObject = new T<abi_t{6,2,9200,0}>();
                    else
                        *ppvObject = new T<abi_t{}>();

                    return S_OK;
                }

                #define CreateThing_INSTANTIATE(T) \\
                    template class T<abi_t{}>; \\
                    template class T<abi_t{6,2,9200,0}>; \\
                    template class T<abi_t{10,0,15063,0}>

                #endif // __factory_g_h__
                """), result.headerText);

        assertTrue(result.hasStubs());
        assertEquals("impls_factory.g.h", result.stubsFileName);
        assertEquals("""
                #pragma once
                #ifndef __impls_factory_g_h__
                #define __impls_factory_g_h__

                #include "factory.g.h"

                #endif // __impls_factory_g_h__
                """, result.stubsText);
    }

    @Test
    void factoryWithoutBreakpointsAlwaysBuildsTheBaseline(@TempDir Path dir) throws Exception {
        Path root = write(dir, "flat.xdl", "struct P { int x; };\n");

        String h = emit(root, EmitterOptions.defaults().withFactoryName("Make")).headerText;

        assertTrue(h.contains("""
                        return E_POINTER;

                    *ppvObject = new T<abi_t{}>();

                    return S_OK;
                """), h);
        assertTrue(h.contains("#define Make_INSTANTIATE(T) \\\n    template class T<abi_t{}>\n"), h);
        assertTrue(h.contains("struct P\n{\n    int x;\n};\n"), h);
        assertFalse(h.contains("template<abi_t ABI>\nstruct P"));
    }

    @Test
    void interfaceWithoutUuidIsRejectedAndNothingIsWritten(@TempDir Path dir) throws Exception {
        Path root = write(dir, "bad.xdl", "interface IBad { HRESULT Go(); };\n");
        Path out = dir.resolve("out");

        SemanticException ex = assertThrows(SemanticException.class,
                () -> new HeaderEmitter().emitTo(XdlSourceLoader.load(root), EmitterOptions.defaults(), out));

        assertEquals("IBad", ex.subject());
        assertTrue(ex.getMessage().contains("IBad"), ex.getMessage());
        assertFalse(Files.exists(out));
    }

    @Test
    void unresolvedBaseTypeIsASemanticError(@TempDir Path dir) throws Exception {
        Path root = write(dir, "orphan.xdl", "struct Child : Missing { int x; };\n");

        SemanticException ex = assertThrows(SemanticException.class, () -> emit(root, EmitterOptions.defaults()));
        assertEquals("Child", ex.subject());
        assertTrue(ex.getMessage().contains("Missing"), ex.getMessage());
    }

    @Test
    void interfaceDataConditionalsStaticsAndVersionedEnums(@TempDir Path dir) throws Exception {
        write(dir, "base.xdl", BASE);
        Path root = write(dir, "store.xdl", """
                import "base.xdl";
                namespace demo {
                    enum Mode : uint32_t { A = 1, [added(2,0)] B = 2, };
                    enum Flags : uint8_t { None = 0, };
                    [no_emit] struct Hidden { int h; };

                    [uuid("00000000-0000-0000-0000-000000000003")]
                    interface IStore : IUnknown {
                        int count;
                        [added(2,0)] int capacity;
                        HRESULT Flush();
                        [conditional(_DEBUG)] HRESULT Dump();
                        static HRESULT Open(IStore **out);
                    };
                }
                """);

        String h = emit(root, EmitterOptions.defaults()).headerText;

        assertTrue(h.contains("""
                    namespace details
                    {
                        template<abi_t ABI>
                        struct ModeEnum
                        {
                            enum type : uint32_t
                            {
                                A = 1,
                            };
                        };

                        template<abi_t ABI>
                        requires (ABI >= abi_t{2,0,0,0})
                        struct ModeEnum<ABI>
                        {
                            enum type : uint32_t
                            {
                                A = 1,
                                B = 2,
                            };
                        };
                    }

                    template<abi_t ABI>
                    using Mode = typename details::ModeEnum<ABI>::type;
                """), h);
        assertFalse(h.contains("enum Mode"), "versioned enums have no forward declaration");
        assertTrue(h.contains("    enum Flags : uint8_t;\n"), h);
        assertTrue(h.contains("    enum Flags : uint8_t\n    {\n        None = 0,\n    };\n"), h);
        assertFalse(h.contains("Hidden"));

        assertTrue(h.contains("""
                    namespace details
                    {
                        template<abi_t ABI>
                        struct IStoreData
                        {
                            int count;
                        };

                        template<abi_t ABI>
                        requires (ABI >= abi_t{2,0,0,0})
                        struct IStoreData<ABI>
                        {
                            int count;
                            int capacity;
                        };
                    }

                    template<abi_t ABI>
                    struct IStore : IUnknown, details::IStoreData<ABI>
                    {
                        virtual HRESULT Flush() = 0;
                #if _DEBUG
                        virtual HRESULT Dump() = 0;
                #endif
                        static HRESULT Open(demo::IStore<ABI> **out);
                    };

                    template<abi_t ABI>
                    struct IStoreVtbl : IUnknownVtbl
                    {
                        HRESULT(*Flush)(void *);
                #if _DEBUG
                        HRESULT(*Dump)(void *);
                #endif
                    };
                """), h);
        assertTrue(h.contains("DECLARE_ABI_UUIDOF_HELPER(demo::IStore, 0x00000000,0x0000,0x0000,0x00,0x00,0x00,0x00,0x00,0x00,0x00,0x03)"), h);
    }

    @Test
    void hiddenReturnMethodsGetThunksAndStubs(@TempDir Path dir) throws Exception {
        write(dir, "base.xdl", BASE);
        Path root = write(dir, "shapes.xdl", """
                import "base.xdl";
                namespace demo {
                    struct Rect { int l; int t; int r; int b; };

                    [uuid("00000000-0000-0000-0000-000000000001")]
                    interface IShape : IUnknown {
                        [hidden_return] Rect GetBounds(int scale) const;
                        HRESULT Draw();
                    };

                    [uuid("00000000-0000-0000-0000-000000000002")]
                    interface ICircle : IShape {
                        [hidden_return] Rect GetInner(int);
                    };

                    [no_uuid, no_impl]
                    interface IPlain : IUnknown {
                        void Touch();
                    };
                }
                """);

        EmissionResult result = emit(root, EmitterOptions.defaults().withFactoryName("CreateShape"));
        String h = result.headerText;

        assertTrue(h.contains("""
                    struct IShape : IUnknown
                    {
                    private:
                        virtual demo::Rect *GetBounds_HiddenReturn(void *pResult, int scale) const = 0;
                    public:
                        virtual HRESULT Draw() = 0;
                    };

                    struct IShapeVtbl : IUnknownVtbl
                    {
                        demo::Rect *(*GetBounds)(void *, void *pResult, int scale);
                        HRESULT(*Draw)(void *);
                    };

                    template<abi_t ABI, typename TImpl, typename TInterface = demo::IShape>
                    struct IShapeHiddenReturn : TInterface
                    {
                        demo::Rect *GetBounds_HiddenReturn(void *pResult, int scale) const override
                        {
                            using TAbi = demo::Rect *(*)(void *, void *, int scale);
                            auto method = &TImpl::GetBounds;
                            return (*reinterpret_cast<TAbi *>(&method))(pResult, const_cast<TImpl *>(static_cast<const TImpl *>(this)), scale);
                        }
                    };
                """), h);
        assertTrue(h.contains("""
                    template<abi_t ABI, typename TImpl, typename TInterface = demo::ICircle>
                    struct ICircleHiddenReturn : demo::IShapeHiddenReturn<ABI, TImpl, TInterface>
                    {
                        demo::Rect *GetInner_HiddenReturn(void *pResult, int arg0) override
                        {
                            using TAbi = demo::Rect *(*)(void *, void *, int arg0);
                            auto method = &TImpl::GetInner;
                            return (*reinterpret_cast<TAbi *>(&method))(pResult, static_cast<TImpl *>(this), arg0);
                        }
                    };
                """), h);
        assertTrue(h.contains("struct ICircleVtbl : demo::IShapeVtbl\n"), h);
        assertFalse(h.contains("IPlainHiddenReturn"));
        assertFalse(h.contains("DECLARE_UUIDOF_HELPER(demo::IPlain"));

        String stubs = result.stubsText;
        assertTrue(stubs.contains("""
                    template<abi_t ABI>
                    class ICircleStub : public demo::ICircleHiddenReturn<ABI, ICircleStub<ABI>>
                    {
                    public:
                        HRESULT QueryInterface(GUID const &riid, void **ppv);
                        demo::Rect GetBounds(int scale) const;
                        HRESULT Draw();
                        demo::Rect GetInner(int);
                    };
                """), stubs);
        assertTrue(stubs.contains("""
                    template<abi_t ABI>
                    HRESULT ICircleStub<ABI>::Draw()
                    {
                        IMPLEMENT_STUB();
                        return E_NOTIMPL;
                    }
                """), stubs);
        assertTrue(stubs.contains("""
                    template<abi_t ABI>
                    demo::Rect ICircleStub<ABI>::GetInner(int)
                    {
                        IMPLEMENT_STUB();
                        return {};
                    }
                """), stubs);
        assertTrue(stubs.contains("class IShapeStub : public demo::IShapeHiddenReturn<ABI, IShapeStub<ABI>>"), stubs);
        assertFalse(stubs.contains("IPlainStub"));
        assertTrue(stubs.startsWith("#pragma once\n#ifndef __impls_shapes_g_h__\n#define __impls_shapes_g_h__\n\n#include \"shapes.g.h\"\n"));
    }

    @Test
    void voidStubsReturnNothing(@TempDir Path dir) throws Exception {
        Path root = write(dir, "plain.xdl", """
                [no_uuid]
                interface IPlain {
                    void Touch();
                };
                """);

        String stubs = emit(root, EmitterOptions.defaults().withStubs(true)).stubsText;

        assertTrue(stubs.contains("""
                template<abi_t ABI>
                void IPlainStub<ABI>::Touch()
                {
                    IMPLEMENT_STUB();
                }
                """), stubs);
        assertTrue(stubs.contains("class IPlainStub : public IPlain\n"), stubs);
    }

    @Test
    void structBodiesFollowOnlyTheirFields(@TempDir Path dir) throws Exception {
        Path root = write(dir, "layout.xdl", """
                struct S {
                    int x;
                    [added(10,0,1,0)] void Foo();
                };
                """);

        String h = emit(root, EmitterOptions.defaults()).headerText;

        assertTrue(h.contains("""
                template<abi_t ABI>
                struct S
                {
                    int x;
                };
                """), h);
        assertFalse(h.contains("requires"), h);
        assertFalse(h.contains("Foo"), h);
        assertEquals(1, count(h, "struct S\n{"));
    }

    @Test
    void zeroAddedVersionDoesNotShadowThePrimaryTemplate(@TempDir Path dir) throws Exception {
        Path root = write(dir, "zero.xdl", """
                struct Z {
                    [added(0,0,0,0)] int a;
                    [added(1,0)] int b;
                };
                """);

        String h = emit(root, EmitterOptions.defaults()).headerText;

        assertEquals(1, count(h, "requires"), h);
        assertTrue(h.contains("requires (ABI >= abi_t{1,0,0,0})\nstruct Z<ABI>"), h);
        assertFalse(h.contains("abi_t{} &&"), h);
    }

    @Test
    void methodMovedToANewSlotIsStubbedOnce(@TempDir Path dir) throws Exception {
        Path root = write(dir, "move.xdl", """
                [no_uuid]
                interface IMove {
                    [removed(2,0)] HRESULT Foo();
                    HRESULT Bar();
                    [added(2,0)] HRESULT Foo();
                };
                """);

        EmissionResult result = emit(root, EmitterOptions.defaults().withFactoryName("CreateMove"));

        assertEquals(2, count(result.headerText, "virtual HRESULT Foo() = 0;"), result.headerText);
        String stubs = result.stubsText;
        assertTrue(stubs.contains("""
                public:
                    HRESULT Foo();
                    HRESULT Bar();
                };
                """), stubs);
        assertEquals(1, count(stubs, "HRESULT IMoveStub<ABI>::Foo()"), stubs);
    }

    @Test
    void interfaceWithBothUuidAndNoUuidIsRejected(@TempDir Path dir) throws Exception {
        Path root = write(dir, "both.xdl", """
                [uuid("00000000-0000-0000-0000-000000000009"), no_uuid]
                interface IBoth { HRESULT Go(); };
                """);
        Path out = dir.resolve("out");

        SemanticException e = assertThrows(SemanticException.class,
                () -> new HeaderEmitter().emitTo(XdlSourceLoader.load(root), EmitterOptions.defaults(), out));

        assertEquals("IBoth", e.subject());
        assertTrue(e.getMessage().contains("no_uuid"), e.getMessage());
        assertFalse(Files.exists(out));
    }

    @Test
    void ioFailureOnTheStubsLeavesTheHeaderUnwritten(@TempDir Path dir) throws Exception {
        Path root = write(dir, "one.xdl", "[no_uuid] interface IOne { HRESULT Go(); };\n");
        Path out = dir.resolve("out");
        Files.createDirectories(out.resolve("impls_one.g.h"));

        assertThrows(IOException.class, () -> new HeaderEmitter().emitTo(XdlSourceLoader.load(root),
                EmitterOptions.defaults().withFactoryName("CreateOne"), out));

        assertFalse(Files.exists(out.resolve("one.g.h")));
        try (var listing = Files.list(out)) {
            assertEquals(1, listing.count(), "only the pre-existing directory remains");
        }
    }
}
