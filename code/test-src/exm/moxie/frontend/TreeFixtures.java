package exm.moxie.frontend;

import static exm.moxie.ast.Trees.assign;
import static exm.moxie.ast.Trees.block;
import static exm.moxie.ast.Trees.funcDecl;
import static exm.moxie.ast.Trees.ident;
import static exm.moxie.ast.Trees.params;
import static exm.moxie.ast.Trees.results;
import static exm.moxie.ast.Trees.stringLit;

import java.util.ArrayList;
import java.util.List;

import exm.moxie.ast.MoxieAST;
import exm.moxie.ast.MoxieTokens;
import exm.moxie.ast.Trees;
import exm.moxie.common.Settings;
import exm.moxie.common.exceptions.UserException;

/**
 * Builds small files for tests and digs results out of them
 */
public class TreeFixtures {
  public static final String FILE_NAME = "test.mx";

  public static MoxieAST file(MoxieAST ...decls) {
    return Trees.file(FILE_NAME, "main", decls);
  }

  /**
   * package main; func main() { stmts }
   */
  public static MoxieAST mainFile(MoxieAST ...stmts) {
    return file(mainFunc(stmts));
  }

  public static MoxieAST mainFunc(MoxieAST ...stmts) {
    return funcDecl("main", params(), results(), block(stmts));
  }

  public static MoxieAST define(String name, MoxieAST value) {
    return assign(":=", ident(name), value);
  }

  /**
   * Interpreted string literal
   */
  public static MoxieAST str(String s) {
    return stringLit("\"" + s + "\"");
  }

  public static TransformContext context() {
    return new TransformContext(FILE_NAME, Settings.defaultSettings());
  }

  public static FileTranspiler.Result transpile(MoxieAST file)
                                                throws UserException {
    return new FileTranspiler(Settings.defaultSettings())
                                .transpile(FILE_NAME, file);
  }

  /**
   * Statements of the body of main
   */
  public static MoxieAST mainBody(MoxieAST file) {
    for (MoxieAST decl: file.children()) {
      if (decl.getType() == MoxieTokens.FUNC_DECL &&
          decl.getText().equals("main")) {
        return find(decl, MoxieTokens.BLOCK);
      }
    }
    throw new IllegalArgumentException("No main function");
  }

  public static MoxieAST stmt(MoxieAST file, int i) {
    return mainBody(file).child(i);
  }

  /**
   * @return i'th right hand side expression of an assignment statement
   */
  public static MoxieAST rhs(MoxieAST assign, int i) {
    return assign.child(1).child(i);
  }

  /**
   * @return first node of the type in pre-order, or null
   */
  public static MoxieAST find(MoxieAST tree, int type) {
    if (tree.getType() == type) {
      return tree;
    }
    for (MoxieAST child: tree.children()) {
      MoxieAST found = find(child, type);
      if (found != null) {
        return found;
      }
    }
    return null;
  }

  public static List<MoxieAST> findAll(MoxieAST tree, int type) {
    List<MoxieAST> result = new ArrayList<MoxieAST>();
    findAll(tree, type, result);
    return result;
  }

  private static void findAll(MoxieAST tree, int type,
                              List<MoxieAST> result) {
    if (tree.getType() == type) {
      result.add(tree);
    }
    for (MoxieAST child: tree.children()) {
      findAll(child, type, result);
    }
  }
}
