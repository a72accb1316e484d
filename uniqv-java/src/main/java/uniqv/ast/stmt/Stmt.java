package uniqv.ast.stmt;

public sealed interface Stmt
        permits BlockStmt, IfStmt, WhileStmt, ForStmt, ForRangeStmt, RepeatStmt,
        SwitchStmt, ReturnStmt, VarDeclStmt, ExprStmt {}
