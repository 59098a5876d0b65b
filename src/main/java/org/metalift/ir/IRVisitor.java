package org.metalift.ir;

public interface IRVisitor<R>
{
	R visitProgram(Program program);

	R visitFnDecl(FnDecl fnDecl);

	R visitBlock(Block block);

	// --- Statements ---

	R visitAssign(Assign assign);

	R visitIf(If ifStmt);

	R visitWhile(While whileStmt);

	R visitReturn(Return returnStmt);

	R visitBranch(Branch branch);

	// --- Expressions ---

	R visitBinaryOp(BinaryOp binaryOp);

	R visitUnaryOp(UnaryOp unaryOp);

	R visitCall(Call call);

	R visitChoose(Choose choose);

	R visitField(Field field);

	R visitListAccess(ListAccess listAccess);

	R visitUnpack(Unpack unpack);

	R visitLit(Lit lit);

	R visitVar(Var var);
}
