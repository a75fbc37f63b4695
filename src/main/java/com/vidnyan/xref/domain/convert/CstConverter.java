package com.vidnyan.xref.domain.convert;

import com.vidnyan.xref.domain.cooked.ArgListNode;
import com.vidnyan.xref.domain.cooked.ArgNode;
import com.vidnyan.xref.domain.cooked.AsNameNode;
import com.vidnyan.xref.domain.cooked.AssertStmt;
import com.vidnyan.xref.domain.cooked.AssignStmt;
import com.vidnyan.xref.domain.cooked.AnnAssignStmt;
import com.vidnyan.xref.domain.cooked.AtomTrailerNode;
import com.vidnyan.xref.domain.cooked.AugAssignStmt;
import com.vidnyan.xref.domain.cooked.BreakStmt;
import com.vidnyan.xref.domain.cooked.ClassDefStmt;
import com.vidnyan.xref.domain.cooked.CompForNode;
import com.vidnyan.xref.domain.cooked.CompIfNode;
import com.vidnyan.xref.domain.cooked.CompOpNode;
import com.vidnyan.xref.domain.cooked.ComparisonNode;
import com.vidnyan.xref.domain.cooked.ComprehensionNode;
import com.vidnyan.xref.domain.cooked.ConditionalExprNode;
import com.vidnyan.xref.domain.cooked.ContinueStmt;
import com.vidnyan.xref.domain.cooked.CookedNode;
import com.vidnyan.xref.domain.cooked.DecoratedNode;
import com.vidnyan.xref.domain.cooked.DecoratorNode;
import com.vidnyan.xref.domain.cooked.DelStmt;
import com.vidnyan.xref.domain.cooked.DotNameTrailerNode;
import com.vidnyan.xref.domain.cooked.DotNode;
import com.vidnyan.xref.domain.cooked.DottedAsNameNode;
import com.vidnyan.xref.domain.cooked.DottedAsNamesNode;
import com.vidnyan.xref.domain.cooked.DottedNameNode;
import com.vidnyan.xref.domain.cooked.EllipsisNode;
import com.vidnyan.xref.domain.cooked.EmptyPairNode;
import com.vidnyan.xref.domain.cooked.ExceptClauseNode;
import com.vidnyan.xref.domain.cooked.ExceptHandler;
import com.vidnyan.xref.domain.cooked.ExecStmt;
import com.vidnyan.xref.domain.cooked.FileInput;
import com.vidnyan.xref.domain.cooked.ForStmt;
import com.vidnyan.xref.domain.cooked.FuncDefStmt;
import com.vidnyan.xref.domain.cooked.GlobalStmt;
import com.vidnyan.xref.domain.cooked.IfBranch;
import com.vidnyan.xref.domain.cooked.IfStmt;
import com.vidnyan.xref.domain.cooked.ImportAsNamesNode;
import com.vidnyan.xref.domain.cooked.ImportFromStmt;
import com.vidnyan.xref.domain.cooked.ImportNameStmt;
import com.vidnyan.xref.domain.cooked.KeyValueNode;
import com.vidnyan.xref.domain.cooked.LambdaNode;
import com.vidnyan.xref.domain.cooked.ListNode;
import com.vidnyan.xref.domain.cooked.NameNode;
import com.vidnyan.xref.domain.cooked.NonlocalStmt;
import com.vidnyan.xref.domain.cooked.NumberNode;
import com.vidnyan.xref.domain.cooked.OmittedNode;
import com.vidnyan.xref.domain.cooked.OpNode;
import com.vidnyan.xref.domain.cooked.PassStmt;
import com.vidnyan.xref.domain.cooked.PrintStmt;
import com.vidnyan.xref.domain.cooked.RaiseStmt;
import com.vidnyan.xref.domain.cooked.ReturnStmt;
import com.vidnyan.xref.domain.cooked.SimpleStmt;
import com.vidnyan.xref.domain.cooked.StarExprNode;
import com.vidnyan.xref.domain.cooked.StarNode;
import com.vidnyan.xref.domain.cooked.StarStarExprNode;
import com.vidnyan.xref.domain.cooked.StringNode;
import com.vidnyan.xref.domain.cooked.SubscriptListNode;
import com.vidnyan.xref.domain.cooked.SubscriptNode;
import com.vidnyan.xref.domain.cooked.Suite;
import com.vidnyan.xref.domain.cooked.TfpListNode;
import com.vidnyan.xref.domain.cooked.TnameNode;
import com.vidnyan.xref.domain.cooked.TryStmt;
import com.vidnyan.xref.domain.cooked.TypedArgNode;
import com.vidnyan.xref.domain.cooked.TypedArgNode.ParamKind;
import com.vidnyan.xref.domain.cooked.TypedArgsListNode;
import com.vidnyan.xref.domain.cooked.WhileStmt;
import com.vidnyan.xref.domain.cooked.WithItemNode;
import com.vidnyan.xref.domain.cooked.WithStmt;
import com.vidnyan.xref.domain.cooked.YieldNode;
import com.vidnyan.xref.domain.cst.CstComposite;
import com.vidnyan.xref.domain.cst.CstLeaf;
import com.vidnyan.xref.domain.cst.CstNode;
import com.vidnyan.xref.domain.cst.Symbol;
import com.vidnyan.xref.domain.cst.TokenType;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts a Python CST into the cooked AST, classifying every identifier occurrence as a
 * binding or a reference and recording the names bound in each scope.
 *
 * <p>There is one rule per grammar symbol, selected by {@link #convert}. Each rule either accepts
 * a binding context (it can be the target of an assignment) and passes it to exactly the
 * assignable children, or rejects it with a {@link StructuralInvariantException}.
 *
 * <p>The converter is stateless; all per-file state lives in the {@link ConversionContext}s it
 * creates, so one instance may convert many files concurrently.
 */
@Slf4j
public class CstConverter {

    private static final OmittedNode OMITTED = OmittedNode.INSTANCE;

    /**
     * Converts a whole module. The root must be a {@code file_input} node.
     */
    public FileInput convertModule(CstNode root) {
        if (!root.is(Symbol.FILE_INPUT)) {
            throw new StructuralInvariantException("Expected file_input at the root", root);
        }
        return (FileInput) convert(root, ConversionContext.newScope());
    }

    public CookedNode convert(CstNode node, ConversionContext ctx) {
        if (node instanceof CstLeaf leaf) {
            return convertLeaf(leaf, ctx);
        }
        CstComposite n = (CstComposite) node;
        return switch (n.type()) {
            case FILE_INPUT -> fileInput(n, ctx);
            case SINGLE_INPUT -> singleInput(n, ctx);
            case EVAL_INPUT, STMT, SMALL_STMT, COMPOUND_STMT, FLOW_STMT, IMPORT_STMT, YIELD_STMT,
                    COMP_ITER -> onlyChild(n, ctx);
            case ASYNC_FUNCDEF, ASYNC_STMT -> async(n, ctx);
            case DECORATED -> decorated(n, ctx);
            case DECORATOR -> decorator(n, ctx);
            case DECORATORS, ANNASSIGN, AUGASSIGN -> throw new StructuralInvariantException(
                    n.type().grammarName() + " is only converted by its parent production", n);
            case FUNCDEF -> funcdef(n, ctx);
            case PARAMETERS, TYPEDARGSLIST, VARARGSLIST -> parameterList(n, ctx.reference(), ctx);
            case TNAME, VNAME, TFPDEF, VFPDEF, TFPLIST, VFPLIST -> parameterName(n, ctx.reference(), ctx);
            case LAMBDEF, OLD_LAMBDEF -> lambdef(n, ctx);
            case CLASSDEF -> classdef(n, ctx);
            case SIMPLE_STMT -> simpleStmt(n, ctx);
            case SUITE -> suite(n, ctx);
            case EXPR_STMT -> exprStmt(n, ctx);
            case PRINT_STMT -> printStmt(n, ctx);
            case DEL_STMT -> delStmt(n, ctx);
            case PASS_STMT -> simpleKeyword(n, ctx, new PassStmt());
            case BREAK_STMT -> simpleKeyword(n, ctx, new BreakStmt());
            case CONTINUE_STMT -> simpleKeyword(n, ctx, new ContinueStmt());
            case RETURN_STMT -> returnStmt(n, ctx);
            case RAISE_STMT -> raiseStmt(n, ctx);
            case YIELD_EXPR -> yieldExpr(n, ctx);
            case YIELD_ARG -> yieldArg(n, ctx);
            case IMPORT_NAME -> importName(n, ctx);
            case IMPORT_FROM -> importFrom(n, ctx);
            case IMPORT_AS_NAME -> importAsName(n, ctx);
            case IMPORT_AS_NAMES -> importAsNames(n, ctx);
            case DOTTED_AS_NAME -> dottedAsName(n, ctx);
            case DOTTED_AS_NAMES -> dottedAsNames(n, ctx);
            case DOTTED_NAME -> dottedName(n, ctx);
            case GLOBAL_STMT -> globalStmt(n, ctx);
            case EXEC_STMT -> execStmt(n, ctx);
            case ASSERT_STMT -> assertStmt(n, ctx);
            case IF_STMT -> ifStmt(n, ctx);
            case WHILE_STMT -> whileStmt(n, ctx);
            case FOR_STMT -> forStmt(n, ctx);
            case TRY_STMT -> tryStmt(n, ctx);
            case EXCEPT_CLAUSE -> exceptClause(n, ctx);
            case WITH_STMT -> withStmt(n, ctx);
            case WITH_ITEM -> withItem(n, ctx);
            case WITH_VAR -> withVar(n, ctx);
            case OR_TEST, AND_TEST, EXPR, XOR_EXPR, AND_EXPR, SHIFT_EXPR, ARITH_EXPR, TERM -> binaryOp(n, ctx);
            case NOT_TEST, FACTOR -> unaryOp(n, ctx);
            case COMPARISON -> comparison(n, ctx);
            case COMP_OP -> compOp(n, ctx);
            case STAR_EXPR -> starExpr(n, ctx);
            case TEST, OLD_TEST -> test(n, ctx);
            case POWER -> power(n, ctx);
            case TRAILER -> trailer(n, ctx);
            case ATOM -> atom(n, ctx);
            case LISTMAKER -> listOrComprehension(n, ctx, ListNode.Kind.LISTMAKER, ComprehensionNode.Kind.LIST);
            case TESTLIST_GEXP -> listOrComprehension(n, ctx, ListNode.Kind.TESTLIST_GEXP,
                    ComprehensionNode.Kind.GENERATOR);
            case DICTSETMAKER -> dictSetMaker(n, ctx);
            case COMP_FOR -> compFor(n, ctx);
            case COMP_IF -> compIf(n, ctx);
            case ARGLIST -> arglist(n, ctx);
            case ARGUMENT -> argument(n, ctx);
            case SUBSCRIPTLIST -> subscriptList(n, ctx);
            case SUBSCRIPT -> subscript(n, ctx);
            case SLICEOP -> sliceop(n, ctx);
            case EXPRLIST -> sequence(n, ctx, ListNode.Kind.EXPRLIST);
            case TESTLIST_STAR_EXPR -> sequence(n, ctx, ListNode.Kind.TESTLIST_STAR_EXPR);
            case TESTLIST -> valueSequence(n, ctx, ListNode.Kind.TESTLIST);
            case TESTLIST1 -> valueSequence(n, ctx, ListNode.Kind.TESTLIST1);
            case TESTLIST_SAFE -> valueSequence(n, ctx, ListNode.Kind.TESTLIST_SAFE);
            case ENCODING_DECL -> throw new UnsupportedProductionException("encoding_decl", n);
        };
    }

    // Leaves

    private CookedNode convertLeaf(CstLeaf leaf, ConversionContext ctx) {
        return switch (leaf.type()) {
            case NAME -> name(leaf, ctx);
            case NUMBER -> {
                requireReference(leaf, ctx);
                yield new NumberNode(leaf);
            }
            case STRING -> {
                requireReference(leaf, ctx);
                yield new StringNode(List.of(leaf));
            }
            default -> throw new StructuralInvariantException("No conversion rule for token " + leaf.type(), leaf);
        };
    }

    /**
     * The only place where a scope's bindings grow.
     */
    private NameNode name(CstLeaf leaf, ConversionContext ctx) {
        if (ctx.lhsBinds() && ctx.binder().bind(leaf.value())) {
            return NameNode.binding(leaf);
        }
        return NameNode.reference(leaf);
    }

    private NameNode name(CstNode node, ConversionContext ctx) {
        if (!node.is(TokenType.NAME)) {
            throw new StructuralInvariantException("Expected NAME", node);
        }
        return name((CstLeaf) node, ctx);
    }

    // Module and statements

    private CookedNode fileInput(CstComposite n, ConversionContext ctx) {
        requireReference(n, ctx);
        List<CookedNode> stmts = new ArrayList<>();
        for (CstNode child : n.children()) {
            if (child.is(TokenType.NEWLINE) || child.is(TokenType.ENDMARKER)) {
                continue;
            }
            stmts.add(convert(child, ctx));
        }
        FileInput result = new FileInput(stmts, ctx.binder().snapshot());
        log.debug("Module scope bindings: {}", result.scope().bindings());
        return result;
    }

    private CookedNode singleInput(CstComposite n, ConversionContext ctx) {
        requireReference(n, ctx);
        if (n.child(0).is(TokenType.NEWLINE)) {
            return new PassStmt();
        }
        return convert(n.child(0), ctx);
    }

    private CookedNode onlyChild(CstComposite n, ConversionContext ctx) {
        requireReference(n, ctx);
        return convert(n.child(0), ctx);
    }

    private CookedNode simpleKeyword(CstComposite n, ConversionContext ctx, CookedNode result) {
        requireReference(n, ctx);
        return result;
    }

    private CookedNode async(CstComposite n, ConversionContext ctx) {
        requireReference(n, ctx);
        expect(n.child(0).is(TokenType.ASYNC) || n.child(0).isKeyword("async"), "Expected async", n);
        return convert(n.child(1), ctx);
    }

    private CookedNode simpleStmt(CstComposite n, ConversionContext ctx) {
        requireReference(n, ctx);
        List<CookedNode> stmts = new ArrayList<>();
        for (CstNode child : n.children()) {
            if (!child.is(TokenType.SEMI) && !child.is(TokenType.NEWLINE)) {
                stmts.add(convert(child, ctx));
            }
        }
        return new SimpleStmt(stmts);
    }

    private CookedNode suite(CstComposite n, ConversionContext ctx) {
        requireReference(n, ctx);
        List<CookedNode> stmts = new ArrayList<>();
        for (CstNode child : n.children()) {
            if (!child.is(TokenType.NEWLINE) && !child.is(TokenType.INDENT) && !child.is(TokenType.DEDENT)) {
                stmts.add(convert(child, ctx));
            }
        }
        return new Suite(stmts);
    }

    /**
     * expr_stmt: testlist_star_expr (annassign | augassign (yield_expr|testlist) |
     * ('=' (yield_expr|testlist_star_expr))*)
     */
    private CookedNode exprStmt(CstComposite n, ConversionContext ctx) {
        requireReference(n, ctx);
        if (n.size() == 1) {
            return convert(n.child(0), ctx);
        }
        CstNode second = n.child(1);
        if (second.is(Symbol.ANNASSIGN)) {
            CstComposite annassign = (CstComposite) second;
            CookedNode target = convert(n.child(0), ctx.binding());
            CookedNode exprType = convert(annassign.child(1), ctx);
            CookedNode expr = annassign.size() == 4 ? convert(annassign.child(3), ctx) : OMITTED;
            return new AnnAssignStmt(target, exprType, expr);
        }
        if (second.is(TokenType.EQUAL)) {
            List<CookedNode> targets = new ArrayList<>();
            for (int i = 0; i < n.size() - 1; i += 2) {
                expect(n.child(i + 1).is(TokenType.EQUAL), "Expected '=' between assignment targets", n);
                targets.add(convert(n.child(i), ctx.binding()));
            }
            return new AssignStmt(targets, convert(n.last(), ctx));
        }
        CstLeaf op = augassignOperator(second);
        expect(n.size() == 3, "Augmented assignment with " + n.size() + " children", n);
        return new AugAssignStmt(convert(n.child(0), ctx), op, convert(n.child(2), ctx));
    }

    private CstLeaf augassignOperator(CstNode node) {
        CstNode op = node.is(Symbol.AUGASSIGN) ? ((CstComposite) node).child(0) : node;
        if (op instanceof CstLeaf leaf && leaf.type().isOperator() && leaf.value().endsWith("=")) {
            return leaf;
        }
        throw new StructuralInvariantException("Expected augmented assignment operator", node);
    }

    /**
     * print_stmt: 'print' ( [ test (',' test)* [','] ] | '>>' test [ (',' test)+ [','] ] )
     */
    private CookedNode printStmt(CstComposite n, ConversionContext ctx) {
        requireReference(n, ctx);
        int i = 1;
        CookedNode dest = OMITTED;
        if (n.size() > 1 && n.child(1).is(TokenType.RIGHTSHIFT)) {
            dest = convert(n.child(2), ctx);
            i = 3;
        }
        List<CookedNode> items = new ArrayList<>();
        for (; i < n.size(); i++) {
            if (!n.child(i).is(TokenType.COMMA)) {
                items.add(convert(n.child(i), ctx));
            }
        }
        return new PrintStmt(dest, items);
    }

    private CookedNode delStmt(CstComposite n, ConversionContext ctx) {
        requireReference(n, ctx);
        return new DelStmt(convert(n.child(1), ctx));
    }

    private CookedNode returnStmt(CstComposite n, ConversionContext ctx) {
        requireReference(n, ctx);
        return new ReturnStmt(n.size() == 2 ? convert(n.child(1), ctx) : OMITTED);
    }

    /**
     * raise_stmt: 'raise' [test ['from' test | ',' test [',' test]]]
     */
    private CookedNode raiseStmt(CstComposite n, ConversionContext ctx) {
        requireReference(n, ctx);
        CookedNode exc = OMITTED;
        CookedNode value = OMITTED;
        CookedNode traceback = OMITTED;
        CookedNode cause = OMITTED;
        if (n.size() > 1) {
            exc = convert(n.child(1), ctx);
        }
        if (n.size() > 3) {
            if (n.child(2).isKeyword("from")) {
                cause = convert(n.child(3), ctx);
            } else {
                value = convert(n.child(3), ctx);
                if (n.size() > 5) {
                    traceback = convert(n.child(5), ctx);
                }
            }
        }
        return new RaiseStmt(exc, value, traceback, cause);
    }

    /**
     * yield_expr: 'yield' [yield_arg]
     */
    private CookedNode yieldExpr(CstComposite n, ConversionContext ctx) {
        requireReference(n, ctx);
        if (n.size() == 1) {
            return new YieldNode(OMITTED, false);
        }
        CstNode arg = n.child(1);
        boolean from = arg.is(Symbol.YIELD_ARG) && ((CstComposite) arg).child(0).isKeyword("from");
        return new YieldNode(convert(arg, ctx), from);
    }

    /**
     * yield_arg: 'from' test | testlist
     */
    private CookedNode yieldArg(CstComposite n, ConversionContext ctx) {
        requireReference(n, ctx);
        return convert(n.last(), ctx);
    }

    private CookedNode globalStmt(CstComposite n, ConversionContext ctx) {
        requireReference(n, ctx);
        boolean global = n.child(0).isKeyword("global");
        expect(global || n.child(0).isKeyword("nonlocal"), "Expected global or nonlocal", n);
        List<NameNode> names = new ArrayList<>();
        for (CstNode child : n.children().subList(1, n.size())) {
            if (child.is(TokenType.COMMA)) {
                continue;
            }
            NameNode name = name(child, ctx.reference());
            if (global) {
                ctx.binder().declareGlobal(name.name());
            } else {
                ctx.binder().declareNonlocal(name.name());
            }
            names.add(name);
        }
        return global ? new GlobalStmt(names) : new NonlocalStmt(names);
    }

    /**
     * exec_stmt: 'exec' expr ['in' test [',' test]]
     */
    private CookedNode execStmt(CstComposite n, ConversionContext ctx) {
        requireReference(n, ctx);
        CookedNode code = convert(n.child(1), ctx);
        CookedNode globals = n.size() >= 4 ? convert(n.child(3), ctx) : OMITTED;
        CookedNode locals = n.size() >= 6 ? convert(n.child(5), ctx) : OMITTED;
        return new ExecStmt(code, globals, locals);
    }

    private CookedNode assertStmt(CstComposite n, ConversionContext ctx) {
        requireReference(n, ctx);
        CookedNode test = convert(n.child(1), ctx);
        return new AssertStmt(test, n.size() == 4 ? convert(n.child(3), ctx) : OMITTED);
    }

    // Imports

    private CookedNode importName(CstComposite n, ConversionContext ctx) {
        requireReference(n, ctx);
        return new ImportNameStmt(dottedAsNamesOf(n.child(1), ctx));
    }

    /**
     * import_from: ('from' ('.'* dotted_name | '.'+)
     * 'import' ('*' | '(' import_as_names ')' | import_as_names))
     */
    private CookedNode importFrom(CstComposite n, ConversionContext ctx) {
        requireReference(n, ctx);
        List<CookedNode> fromName = new ArrayList<>();
        int i = 1;
        for (; i < n.size() && !n.child(i).isKeyword("import"); i++) {
            CstNode child = n.child(i);
            if (child.is(TokenType.DOT)) {
                fromName.add(new DotNode());
            } else {
                fromName.add(dottedNameOf(child, ctx));
            }
        }
        expect(i < n.size() - 1, "Expected 'import' followed by names", n);
        CstNode part = n.child(i + 1);
        CookedNode importPart;
        if (part.is(TokenType.STAR)) {
            importPart = new StarNode();
        } else if (part.is(TokenType.LPAR)) {
            importPart = importAsNamesOf(n.child(i + 2), ctx);
        } else {
            importPart = importAsNamesOf(part, ctx);
        }
        return new ImportFromStmt(fromName, importPart);
    }

    /**
     * import_as_name: NAME ['as' NAME]
     */
    private CookedNode importAsName(CstComposite n, ConversionContext ctx) {
        requireReference(n, ctx);
        NameNode name = name(n.child(0), ctx.reference());
        NameNode asName = name(n.size() == 1 ? n.child(0) : n.child(2), ctx.binding());
        return new AsNameNode(name, asName);
    }

    private CookedNode importAsNames(CstComposite n, ConversionContext ctx) {
        requireReference(n, ctx);
        List<AsNameNode> names = new ArrayList<>();
        for (CstNode child : skipCommas(n)) {
            if (child.is(TokenType.NAME)) {
                names.add(new AsNameNode(name(child, ctx.reference()), name(child, ctx.binding())));
            } else {
                names.add(as(AsNameNode.class, convert(child, ctx), child));
            }
        }
        return new ImportAsNamesNode(names);
    }

    private ImportAsNamesNode importAsNamesOf(CstNode node, ConversionContext ctx) {
        if (node.is(Symbol.IMPORT_AS_NAMES)) {
            return (ImportAsNamesNode) convert(node, ctx);
        }
        CookedNode single = node.is(TokenType.NAME)
                ? new AsNameNode(name(node, ctx.reference()), name(node, ctx.binding()))
                : convert(node, ctx);
        return new ImportAsNamesNode(List.of(as(AsNameNode.class, single, node)));
    }

    /**
     * dotted_as_name: dotted_name ['as' NAME]. Without an alias, {@code import a.b} binds
     * {@code a}.
     */
    private CookedNode dottedAsName(CstComposite n, ConversionContext ctx) {
        requireReference(n, ctx);
        DottedNameNode dotted = dottedNameOf(n.child(0), ctx);
        NameNode asName = n.size() == 1
                ? name(dotted.names().get(0).token(), ctx.binding())
                : name(n.child(2), ctx.binding());
        return new DottedAsNameNode(dotted, asName);
    }

    private CookedNode dottedAsNames(CstComposite n, ConversionContext ctx) {
        requireReference(n, ctx);
        List<DottedAsNameNode> names = new ArrayList<>();
        for (CstNode child : skipCommas(n)) {
            names.add(dottedAsNameOf(child, ctx));
        }
        return new DottedAsNamesNode(names);
    }

    private DottedAsNamesNode dottedAsNamesOf(CstNode node, ConversionContext ctx) {
        if (node.is(Symbol.DOTTED_AS_NAMES)) {
            return (DottedAsNamesNode) convert(node, ctx);
        }
        return new DottedAsNamesNode(List.of(dottedAsNameOf(node, ctx)));
    }

    private DottedAsNameNode dottedAsNameOf(CstNode node, ConversionContext ctx) {
        if (node.is(Symbol.DOTTED_AS_NAME)) {
            return (DottedAsNameNode) convert(node, ctx);
        }
        DottedNameNode dotted = dottedNameOf(node, ctx);
        return new DottedAsNameNode(dotted, name(dotted.names().get(0).token(), ctx.binding()));
    }

    /**
     * dotted_name: NAME ('.' NAME)*. Only the last component can be in a binding position.
     */
    private CookedNode dottedName(CstComposite n, ConversionContext ctx) {
        List<NameNode> names = new ArrayList<>();
        for (int i = 0; i < n.size(); i++) {
            CstNode child = n.child(i);
            if (child.is(TokenType.DOT)) {
                continue;
            }
            names.add(name(child, i == n.size() - 1 ? ctx : ctx.reference()));
        }
        return new DottedNameNode(names);
    }

    private DottedNameNode dottedNameOf(CstNode node, ConversionContext ctx) {
        if (node.is(TokenType.NAME)) {
            return new DottedNameNode(List.of(name(node, ctx)));
        }
        return as(DottedNameNode.class, convert(node, ctx), node);
    }

    // Compound statements

    private CookedNode ifStmt(CstComposite n, ConversionContext ctx) {
        requireReference(n, ctx);
        List<IfBranch> branches = new ArrayList<>();
        CookedNode elseSuite = OMITTED;
        int i = 0;
        while (i < n.size()) {
            CstNode keyword = n.child(i);
            if (keyword.isKeyword("if") || keyword.isKeyword("elif")) {
                branches.add(new IfBranch(convert(n.child(i + 1), ctx), convert(n.child(i + 3), ctx)));
                i += 4;
            } else if (keyword.isKeyword("else")) {
                elseSuite = convert(n.child(i + 2), ctx);
                i += 3;
            } else {
                throw new StructuralInvariantException("Unexpected child of if_stmt", keyword);
            }
        }
        return new IfStmt(branches, elseSuite);
    }

    private CookedNode whileStmt(CstComposite n, ConversionContext ctx) {
        requireReference(n, ctx);
        CookedNode test = convert(n.child(1), ctx);
        CookedNode suite = convert(n.child(3), ctx);
        return new WhileStmt(test, suite, n.size() == 7 ? convert(n.child(6), ctx) : OMITTED);
    }

    /**
     * for_stmt: 'for' exprlist 'in' testlist ':' suite ['else' ':' suite]
     */
    private CookedNode forStmt(CstComposite n, ConversionContext ctx) {
        requireReference(n, ctx);
        CookedNode exprlist = convert(n.child(1), ctx.binding());
        CookedNode testlist = convert(n.child(3), ctx);
        CookedNode suite = convert(n.child(5), ctx);
        return new ForStmt(exprlist, testlist, suite, n.size() == 9 ? convert(n.child(8), ctx) : OMITTED);
    }

    /**
     * try_stmt: ('try' ':' suite ((except_clause ':' suite)+ ['else' ':' suite]
     * ['finally' ':' suite] | 'finally' ':' suite))
     */
    private CookedNode tryStmt(CstComposite n, ConversionContext ctx) {
        requireReference(n, ctx);
        CookedNode body = convert(n.child(2), ctx);
        List<ExceptHandler> handlers = new ArrayList<>();
        CookedNode elseSuite = OMITTED;
        CookedNode finallySuite = OMITTED;
        for (int i = 3; i < n.size(); i += 3) {
            CstNode head = n.child(i);
            CookedNode suite = convert(n.child(i + 2), ctx);
            if (head.is(Symbol.EXCEPT_CLAUSE)) {
                handlers.add(new ExceptHandler((ExceptClauseNode) convert(head, ctx), suite));
            } else if (head.isKeyword("except")) {
                handlers.add(new ExceptHandler(new ExceptClauseNode(OMITTED, OMITTED), suite));
            } else if (head.isKeyword("else")) {
                elseSuite = suite;
            } else if (head.isKeyword("finally")) {
                finallySuite = suite;
            } else {
                throw new StructuralInvariantException("Unexpected child of try_stmt", head);
            }
        }
        return new TryStmt(body, handlers, elseSuite, finallySuite);
    }

    /**
     * except_clause: 'except' [test [(',' | 'as') test]]
     */
    private CookedNode exceptClause(CstComposite n, ConversionContext ctx) {
        requireReference(n, ctx);
        CookedNode exc = n.size() >= 2 ? convert(n.child(1), ctx) : OMITTED;
        CookedNode target = n.size() == 4 ? convert(n.child(3), ctx.binding()) : OMITTED;
        return new ExceptClauseNode(exc, target);
    }

    /**
     * with_stmt: 'with' with_item (',' with_item)* ':' suite
     */
    private CookedNode withStmt(CstComposite n, ConversionContext ctx) {
        requireReference(n, ctx);
        List<WithItemNode> items = new ArrayList<>();
        for (CstNode child : n.children().subList(1, n.size() - 2)) {
            if (child.is(TokenType.COMMA)) {
                continue;
            }
            if (child.is(Symbol.WITH_ITEM)) {
                items.add((WithItemNode) convert(child, ctx));
            } else {
                items.add(new WithItemNode(convert(child, ctx), OMITTED));
            }
        }
        return new WithStmt(items, convert(n.last(), ctx));
    }

    /**
     * with_item: test ['as' expr]
     */
    private CookedNode withItem(CstComposite n, ConversionContext ctx) {
        requireReference(n, ctx);
        CookedNode item = convert(n.child(0), ctx);
        CookedNode asItem = n.size() == 3 ? convert(n.child(2), ctx.binding()) : OMITTED;
        return new WithItemNode(item, asItem);
    }

    private CookedNode withVar(CstComposite n, ConversionContext ctx) {
        requireReference(n, ctx);
        return convert(n.child(1), ctx.binding());
    }

    // Scopes

    /**
     * decorated: decorators (classdef | funcdef | async_funcdef)
     */
    private CookedNode decorated(CstComposite n, ConversionContext ctx) {
        requireReference(n, ctx);
        List<DecoratorNode> decorators = new ArrayList<>();
        CstNode head = n.child(0);
        List<CstNode> decoratorNodes = head.is(Symbol.DECORATORS) ? ((CstComposite) head).children() : List.of(head);
        for (CstNode decorator : decoratorNodes) {
            decorators.add(as(DecoratorNode.class, convert(decorator, ctx), decorator));
        }
        return new DecoratedNode(decorators, convert(n.child(1), ctx));
    }

    /**
     * decorator: '@' dotted_name [ '(' [arglist] ')' ] NEWLINE
     */
    private CookedNode decorator(CstComposite n, ConversionContext ctx) {
        requireReference(n, ctx);
        DottedNameNode name = dottedNameOf(n.child(1), ctx);
        CookedNode arglist = OMITTED;
        if (n.child(2).is(TokenType.LPAR)) {
            arglist = n.child(3).is(TokenType.RPAR)
                    ? new EmptyPairNode(EmptyPairNode.Pair.PARENS)
                    : convert(n.child(3), ctx);
        }
        return new DecoratorNode(name, arglist);
    }

    /**
     * funcdef: 'def' NAME parameters ['->' test] ':' suite
     */
    private CookedNode funcdef(CstComposite n, ConversionContext ctx) {
        requireReference(n, ctx);
        NameNode name = name(n.child(1), ctx.binding());
        ConversionContext body = ConversionContext.newScope();
        TypedArgsListNode parameters = parameterList(n.child(2), ctx, body);
        CookedNode returnType = n.child(3).is(TokenType.RARROW) ? convert(n.child(4), ctx) : OMITTED;
        CookedNode suite = convert(n.last(), body);
        FuncDefStmt result = new FuncDefStmt(name, parameters, returnType, suite, body.binder().snapshot());
        log.debug("Function {} scope bindings: {}", name.name(), result.scope().bindings());
        return result;
    }

    /**
     * lambdef: 'lambda' [varargslist] ':' test
     */
    private CookedNode lambdef(CstComposite n, ConversionContext ctx) {
        requireReference(n, ctx);
        ConversionContext body = ConversionContext.newScope();
        TypedArgsListNode parameters = n.size() == 4
                ? parameterList(n.child(1), ctx, body)
                : TypedArgsListNode.empty();
        CookedNode expr = convert(n.last(), body);
        return new LambdaNode(parameters, expr, body.binder().snapshot());
    }

    /**
     * classdef: 'class' NAME ['(' [arglist] ')'] ':' suite
     */
    private CookedNode classdef(CstComposite n, ConversionContext ctx) {
        requireReference(n, ctx);
        NameNode name = name(n.child(1), ctx.binding());
        CookedNode bases = OMITTED;
        if (n.child(2).is(TokenType.LPAR) && !n.child(3).is(TokenType.RPAR)) {
            bases = convert(n.child(3), ctx);
        }
        ConversionContext body = ConversionContext.newScope();
        CookedNode suite = convert(n.last(), body);
        ClassDefStmt result = new ClassDefStmt(name, bases, suite, body.binder().snapshot());
        log.debug("Class {} scope bindings: {}", name.name(), result.scope().bindings());
        return result;
    }

    /**
     * Parameters of a def or lambda. Defaults and annotations belong to {@code outer}; the
     * parameter names bind in {@code inner}.
     *
     * <pre>
     * parameters: '(' [typedargslist] ')'
     * typedargslist: tfpdef ['=' test] (',' tfpdef ['=' test])* [',' ['*' [tname] ... ['**' tname]]]
     * </pre>
     */
    private TypedArgsListNode parameterList(CstNode node, ConversionContext outer, ConversionContext inner) {
        if (node.is(Symbol.PARAMETERS)) {
            CstComposite parameters = (CstComposite) node;
            return parameters.size() == 2
                    ? TypedArgsListNode.empty()
                    : parameterList(parameters.child(1), outer, inner);
        }
        if (!node.is(Symbol.TYPEDARGSLIST) && !node.is(Symbol.VARARGSLIST)) {
            CookedNode single = parameterName(node, outer, inner);
            return new TypedArgsListNode(List.of(new TypedArgNode(single, OMITTED, ParamKind.PLAIN)));
        }
        CstComposite n = (CstComposite) node;
        List<TypedArgNode> args = new ArrayList<>();
        ParamKind kind = ParamKind.PLAIN;
        int i = 0;
        while (i < n.size()) {
            CstNode child = n.child(i);
            if (child.is(TokenType.COMMA)) {
                kind = ParamKind.PLAIN;
                i++;
            } else if (child.is(TokenType.STAR)) {
                kind = ParamKind.VARARGS;
                i++;
            } else if (child.is(TokenType.DOUBLESTAR)) {
                kind = ParamKind.KWARGS;
                i++;
            } else {
                CookedNode name = parameterName(child, outer, inner);
                CookedNode defaultValue = OMITTED;
                i++;
                if (i < n.size() && n.child(i).is(TokenType.EQUAL)) {
                    defaultValue = convert(n.child(i + 1), outer.reference());
                    i += 2;
                }
                args.add(new TypedArgNode(name, defaultValue, kind));
                kind = ParamKind.PLAIN;
            }
        }
        return new TypedArgsListNode(args);
    }

    /**
     * tname: NAME [':' test]; tfpdef: tname | '(' tfplist ')'; tfplist: tfpdef (',' tfpdef)* [',']
     * and the vname/vfpdef/vfplist equivalents of lambdas.
     */
    private CookedNode parameterName(CstNode node, ConversionContext outer, ConversionContext inner) {
        if (node.is(TokenType.NAME)) {
            return new TnameNode(name(node, inner.binding()), OMITTED);
        }
        if (!(node instanceof CstComposite n)) {
            throw new StructuralInvariantException("Expected a parameter", node);
        }
        switch (n.type()) {
            case TNAME, VNAME -> {
                NameNode name = name(n.child(0), inner.binding());
                CookedNode typeExpr = n.size() == 3 ? convert(n.child(2), outer.reference()) : OMITTED;
                return new TnameNode(name, typeExpr);
            }
            case TFPDEF, VFPDEF -> {
                return parameterName(n.size() == 1 ? n.child(0) : n.child(1), outer, inner);
            }
            case TFPLIST, VFPLIST -> {
                List<CookedNode> items = new ArrayList<>();
                for (CstNode child : skipCommas(n)) {
                    items.add(parameterName(child, outer, inner));
                }
                return new TfpListNode(items);
            }
            default -> throw new StructuralInvariantException("Expected a parameter", node);
        }
    }

    // Expressions

    /**
     * or_test, and_test, expr, xor_expr, and_expr, shift_expr, arith_expr, term:
     * operand (op operand)*, folded to the left.
     */
    private CookedNode binaryOp(CstComposite n, ConversionContext ctx) {
        if (n.size() == 1) {
            return convert(n.child(0), ctx);
        }
        requireReference(n, ctx);
        CookedNode result = convert(n.child(0), ctx);
        for (int i = 1; i < n.size(); i += 2) {
            result = new OpNode(leaf(n.child(i)), List.of(result, convert(n.child(i + 1), ctx)));
        }
        return result;
    }

    /**
     * not_test: 'not' not_test | comparison; factor: ('+'|'-'|'~') factor | power
     */
    private CookedNode unaryOp(CstComposite n, ConversionContext ctx) {
        if (n.size() == 1) {
            return convert(n.child(0), ctx);
        }
        requireReference(n, ctx);
        return new OpNode(leaf(n.child(0)), List.of(convert(n.child(1), ctx)));
    }

    /**
     * comparison: expr (comp_op expr)*
     */
    private CookedNode comparison(CstComposite n, ConversionContext ctx) {
        if (n.size() == 1) {
            return convert(n.child(0), ctx);
        }
        requireReference(n, ctx);
        List<CookedNode> operands = new ArrayList<>();
        List<CompOpNode> ops = new ArrayList<>();
        operands.add(convert(n.child(0), ctx));
        for (int i = 1; i < n.size(); i += 2) {
            CstNode op = n.child(i);
            ops.add(op.is(Symbol.COMP_OP) ? (CompOpNode) convert(op, ctx) : new CompOpNode(List.of(leaf(op))));
            operands.add(convert(n.child(i + 1), ctx));
        }
        return new ComparisonNode(operands, ops);
    }

    private CookedNode compOp(CstComposite n, ConversionContext ctx) {
        requireReference(n, ctx);
        List<CstLeaf> ops = new ArrayList<>();
        for (CstNode child : n.children()) {
            ops.add(leaf(child));
        }
        return new CompOpNode(ops);
    }

    /**
     * star_expr: '*' expr. Allowed as an unpacking target.
     */
    private CookedNode starExpr(CstComposite n, ConversionContext ctx) {
        return new StarExprNode(convert(n.child(1), ctx));
    }

    /**
     * test: or_test ['if' or_test 'else' test] | lambdef
     */
    private CookedNode test(CstComposite n, ConversionContext ctx) {
        if (n.size() == 1) {
            return convert(n.child(0), ctx);
        }
        requireReference(n, ctx);
        expect(n.size() == 5 && n.child(1).isKeyword("if"), "Malformed conditional expression", n);
        CookedNode then = convert(n.child(0), ctx);
        CookedNode test = convert(n.child(2), ctx);
        CookedNode orElse = convert(n.child(4), ctx);
        return new ConditionalExprNode(then, test, orElse);
    }

    /**
     * power: [AWAIT] atom trailer* ['**' factor]. In a target such as {@code a.b[c].d = 1}
     * only the last trailer sees the binding context.
     */
    private CookedNode power(CstComposite n, ConversionContext ctx) {
        List<CstNode> parts = n.children();
        if (parts.get(0).is(TokenType.AWAIT) || parts.get(0).isKeyword("await")) {
            requireReference(n, ctx);
            parts = parts.subList(1, parts.size());
        }
        CstLeaf powerOp = null;
        CstNode exponent = null;
        if (parts.size() >= 3 && parts.get(parts.size() - 2).is(TokenType.DOUBLESTAR)) {
            requireReference(n, ctx);
            powerOp = (CstLeaf) parts.get(parts.size() - 2);
            exponent = parts.get(parts.size() - 1);
            parts = parts.subList(0, parts.size() - 2);
        }
        CookedNode base;
        if (parts.size() == 1) {
            base = convert(parts.get(0), ctx);
        } else {
            CookedNode atom = convert(parts.get(0), ctx.reference());
            List<CookedNode> trailers = new ArrayList<>();
            for (int i = 1; i < parts.size(); i++) {
                trailers.add(convert(parts.get(i), i == parts.size() - 1 ? ctx : ctx.reference()));
            }
            base = new AtomTrailerNode(atom, trailers);
        }
        if (powerOp == null) {
            return base;
        }
        return new OpNode(powerOp, List.of(base, convert(exponent, ctx)));
    }

    /**
     * trailer: '(' [arglist] ')' | '[' subscriptlist ']' | '.' NAME
     */
    private CookedNode trailer(CstComposite n, ConversionContext ctx) {
        CstNode open = n.child(0);
        if (open.is(TokenType.LPAR)) {
            requireReference(n, ctx);
            return n.size() == 2
                    ? new EmptyPairNode(EmptyPairNode.Pair.PARENS)
                    : convert(n.child(1), ctx.reference());
        }
        if (open.is(TokenType.LSQB)) {
            return convert(n.child(1), ctx.reference());
        }
        expect(open.is(TokenType.DOT), "Unexpected trailer", n);
        return new DotNameTrailerNode(name(n.child(1), ctx.reference()), ctx.lhsBinds());
    }

    /**
     * atom: ('(' [yield_expr|testlist_gexp] ')' | '[' [listmaker] ']' | '{' [dictsetmaker] '}' |
     * '`' testlist1 '`' | NAME | NUMBER | STRING+ | '.' '.' '.')
     */
    private CookedNode atom(CstComposite n, ConversionContext ctx) {
        CstNode first = n.child(0);
        if (first.is(TokenType.STRING)) {
            requireReference(n, ctx);
            List<CstLeaf> strings = new ArrayList<>();
            for (CstNode child : n.children()) {
                strings.add(leaf(child));
            }
            return new StringNode(strings);
        }
        if (first.is(TokenType.NAME) || first.is(TokenType.NUMBER)) {
            return convert(first, ctx);
        }
        if (first.is(TokenType.DOT)) {
            requireReference(n, ctx);
            expect(n.size() == 3, "Expected '...'", n);
            return new EllipsisNode();
        }
        EmptyPairNode.Pair pair = pairOf(first);
        if (n.size() == 2) {
            return new EmptyPairNode(pair);
        }
        CstNode inner = n.child(1);
        return switch (pair) {
            case PARENS, BRACKETS -> convert(inner, ctx);
            case BRACES, BACKQUOTES -> {
                requireReference(n, ctx);
                yield convert(inner, ctx);
            }
        };
    }

    private EmptyPairNode.Pair pairOf(CstNode open) {
        if (open.is(TokenType.LPAR)) {
            return EmptyPairNode.Pair.PARENS;
        }
        if (open.is(TokenType.LSQB)) {
            return EmptyPairNode.Pair.BRACKETS;
        }
        if (open.is(TokenType.LBRACE)) {
            return EmptyPairNode.Pair.BRACES;
        }
        if (open.is(TokenType.BACKQUOTE)) {
            return EmptyPairNode.Pair.BACKQUOTES;
        }
        throw new StructuralInvariantException("Invalid atom", open);
    }

    /**
     * listmaker and testlist_gexp: (test|star_expr) ( comp_for | (',' (test|star_expr))* [','] ).
     * A parenthesized single expression without a comma is just that expression.
     */
    private CookedNode listOrComprehension(CstComposite n, ConversionContext ctx,
                                           ListNode.Kind listKind, ComprehensionNode.Kind comprehensionKind) {
        if (n.size() == 2 && n.child(1).is(Symbol.COMP_FOR)) {
            requireReference(n, ctx);
            CompForNode compFor = (CompForNode) convert(n.child(1), ctx);
            return new ComprehensionNode(comprehensionKind, convert(n.child(0), ctx), compFor);
        }
        if (n.size() == 1 && listKind == ListNode.Kind.TESTLIST_GEXP) {
            return convert(n.child(0), ctx);
        }
        return new ListNode(listKind, convertSkipCommas(n, ctx));
    }

    /**
     * dictsetmaker: ( ((test ':' test | '**' expr) (comp_for | (',' (test ':' test | '**' expr))* [','])) |
     * ((test | star_expr) (comp_for | (',' (test | star_expr))* [','])) )
     */
    private CookedNode dictSetMaker(CstComposite n, ConversionContext ctx) {
        requireReference(n, ctx);
        if (n.last().is(Symbol.COMP_FOR)) {
            CompForNode compFor = (CompForNode) convert(n.last(), ctx);
            if (n.size() == 4 && n.child(1).is(TokenType.COLON)) {
                CookedNode key = convert(n.child(0), ctx);
                CookedNode value = convert(n.child(2), ctx);
                return new ComprehensionNode(ComprehensionNode.Kind.DICT, new KeyValueNode(key, value), compFor);
            }
            if (n.size() == 3 && n.child(0).is(TokenType.DOUBLESTAR)) {
                return new ComprehensionNode(ComprehensionNode.Kind.DICT,
                        new StarStarExprNode(convert(n.child(1), ctx)), compFor);
            }
            expect(n.size() == 2, "Malformed comprehension", n);
            return new ComprehensionNode(ComprehensionNode.Kind.SET, convert(n.child(0), ctx), compFor);
        }
        List<CookedNode> items = new ArrayList<>();
        int i = 0;
        while (i < n.size()) {
            CstNode child = n.child(i);
            if (child.is(TokenType.COMMA)) {
                i++;
            } else if (child.is(TokenType.DOUBLESTAR)) {
                items.add(new StarStarExprNode(convert(n.child(i + 1), ctx)));
                i += 2;
            } else if (i + 1 < n.size() && n.child(i + 1).is(TokenType.COLON)) {
                CookedNode key = convert(child, ctx);
                items.add(new KeyValueNode(key, convert(n.child(i + 2), ctx)));
                i += 3;
            } else {
                items.add(convert(child, ctx));
                i++;
            }
        }
        return new ListNode(ListNode.Kind.DICTSETMAKER, items);
    }

    /**
     * comp_for: [ASYNC] 'for' exprlist 'in' testlist_safe [comp_iter]. The loop target binds in
     * the enclosing scope.
     */
    private CookedNode compFor(CstComposite n, ConversionContext ctx) {
        requireReference(n, ctx);
        List<CstNode> parts = n.children();
        if (parts.get(0).is(TokenType.ASYNC) || parts.get(0).isKeyword("async")) {
            parts = parts.subList(1, parts.size());
        }
        CookedNode forExprlist = convert(parts.get(1), ctx.binding());
        CookedNode inTestlist = convert(parts.get(3), ctx);
        CookedNode compIter = parts.size() == 5 ? convert(parts.get(4), ctx) : OMITTED;
        return new CompForNode(forExprlist, inTestlist, compIter);
    }

    /**
     * comp_if: 'if' old_test [comp_iter]
     */
    private CookedNode compIf(CstComposite n, ConversionContext ctx) {
        requireReference(n, ctx);
        CookedNode test = convert(n.child(1), ctx);
        return new CompIfNode(test, n.size() == 3 ? convert(n.child(2), ctx) : OMITTED);
    }

    private CookedNode arglist(CstComposite n, ConversionContext ctx) {
        requireReference(n, ctx);
        List<ArgNode> arguments = new ArrayList<>();
        for (CstNode child : skipCommas(n)) {
            CookedNode argument = convert(child, ctx);
            arguments.add(argument instanceof ArgNode arg ? arg : new ArgNode(OMITTED, argument, OMITTED));
        }
        return new ArgListNode(arguments);
    }

    /**
     * argument: ( test [comp_for] | test '=' test | '**' expr | star_expr )
     */
    private CookedNode argument(CstComposite n, ConversionContext ctx) {
        requireReference(n, ctx);
        CstNode first = n.child(0);
        if (first.is(TokenType.DOUBLESTAR)) {
            return new ArgNode(OMITTED, new StarStarExprNode(convert(n.child(1), ctx)), OMITTED);
        }
        if (first.is(TokenType.STAR)) {
            return new ArgNode(OMITTED, new StarExprNode(convert(n.child(1), ctx)), OMITTED);
        }
        if (n.size() == 1) {
            return new ArgNode(OMITTED, convert(first, ctx), OMITTED);
        }
        if (n.child(1).is(TokenType.EQUAL)) {
            CookedNode keyword = convert(first, ctx);
            return new ArgNode(keyword, convert(n.child(2), ctx), OMITTED);
        }
        expect(n.child(1).is(Symbol.COMP_FOR), "Unexpected argument shape", n);
        CookedNode compFor = convert(n.child(1), ctx);
        return new ArgNode(OMITTED, convert(first, ctx), compFor);
    }

    private CookedNode subscriptList(CstComposite n, ConversionContext ctx) {
        ConversionContext index = ctx.reference();
        List<SubscriptNode> subscripts = new ArrayList<>();
        for (CstNode child : skipCommas(n)) {
            CookedNode subscript = convert(child, index);
            subscripts.add(subscript instanceof SubscriptNode s ? s : SubscriptNode.index(subscript));
        }
        return new SubscriptListNode(subscripts);
    }

    /**
     * subscript: test | [test] ':' [test] [sliceop]
     */
    private CookedNode subscript(CstComposite n, ConversionContext ctx) {
        requireReference(n, ctx);
        CookedNode lower = OMITTED;
        CookedNode upper = OMITTED;
        CookedNode step = OMITTED;
        int i = 0;
        if (!n.child(0).is(TokenType.COLON)) {
            lower = convert(n.child(0), ctx);
            i++;
        }
        if (i == n.size()) {
            return SubscriptNode.index(lower);
        }
        expect(n.child(i).is(TokenType.COLON), "Expected ':' in slice", n);
        i++;
        if (i < n.size() && !n.child(i).is(Symbol.SLICEOP)) {
            upper = convert(n.child(i), ctx);
            i++;
        }
        if (i < n.size()) {
            step = convert(n.child(i), ctx);
        }
        return new SubscriptNode(lower, upper, step, true);
    }

    /**
     * sliceop: ':' [test]
     */
    private CookedNode sliceop(CstComposite n, ConversionContext ctx) {
        requireReference(n, ctx);
        return n.size() == 2 ? convert(n.child(1), ctx) : OMITTED;
    }

    /**
     * exprlist and testlist_star_expr: both can be unpacking targets. A single element without
     * a trailing comma is the element itself.
     */
    private CookedNode sequence(CstComposite n, ConversionContext ctx, ListNode.Kind kind) {
        if (n.size() == 1) {
            return convert(n.child(0), ctx);
        }
        return new ListNode(kind, convertSkipCommas(n, ctx));
    }

    /**
     * testlist, testlist1 and testlist_safe only appear as values.
     */
    private CookedNode valueSequence(CstComposite n, ConversionContext ctx, ListNode.Kind kind) {
        if (n.size() == 1) {
            return convert(n.child(0), ctx);
        }
        requireReference(n, ctx);
        return new ListNode(kind, convertSkipCommas(n, ctx));
    }

    // Helpers

    private List<CookedNode> convertSkipCommas(CstComposite n, ConversionContext ctx) {
        List<CookedNode> result = new ArrayList<>();
        for (CstNode child : skipCommas(n)) {
            result.add(convert(child, ctx));
        }
        return result;
    }

    private static List<CstNode> skipCommas(CstComposite n) {
        return n.children().stream()
                .filter(child -> !child.is(TokenType.COMMA))
                .toList();
    }

    private static CstLeaf leaf(CstNode node) {
        if (node instanceof CstLeaf leaf) {
            return leaf;
        }
        throw new StructuralInvariantException("Expected a token", node);
    }

    private static <T extends CookedNode> T as(Class<T> type, CookedNode converted, CstNode source) {
        if (type.isInstance(converted)) {
            return type.cast(converted);
        }
        throw new StructuralInvariantException(
                "Expected " + type.getSimpleName() + " but got " + converted.getClass().getSimpleName(), source);
    }

    private static void requireReference(CstNode node, ConversionContext ctx) {
        if (ctx.lhsBinds()) {
            throw new StructuralInvariantException("Cannot appear in a binding position", node);
        }
    }

    private static void expect(boolean condition, String message, CstNode node) {
        if (!condition) {
            throw new StructuralInvariantException(message, node);
        }
    }
}
