package com.flamingo.ai.memoryengine.service.classifier;

import java.util.List;
import java.util.stream.Stream;

/**
 * Hand-written reference exemplars used as classifier anchors. A message close to a personal
 * exemplar is worth remembering; one clearly closer to a non-personal exemplar is skipped.
 */
public final class ReferenceCategories {

  private ReferenceCategories() {}

  /**
   * A labelled group of exemplar descriptions.
   *
   * @param reason the skip reason reported when this category wins, null for the personal group
   * @param exemplars exemplar descriptions
   */
  public record ReferenceCategory(SkipReason reason, List<String> exemplars) {}

  public static final List<String> PERSONAL =
      List.of(
          "discussing my family members, like my spouse, children, parents, or siblings. "
              + "Mentioning relatives by name or role, such as my husband, wife, son, daughter, "
              + "mother, or father. Sharing stories or asking questions about my family.",
          "expressing lasting personal feelings, core values, beliefs, or principles. My "
              + "worldview, deeply held opinions, philosophy, or moral standards. Things I love, "
              + "hate, or feel strongly about in life, such as my passion for animal welfare.",
          "describing my established personal hobbies, regular activities, or consistent "
              + "interests. My passions and what I do in my leisure time, such as creative "
              + "outlets like painting, sports like hiking, or other recreational pursuits I "
              + "enjoy.",
          "sharing information about my career or current job. My position, workplace, "
              + "company name, or professional role. My responsibilities at work, my occupation, "
              + "or the industry I work in. My employment situation, job title, and employer.",
          "talking about my major life plans, long-term aspirations, or personal goals. My "
              + "dreams for the future, important intentions, and what I want to achieve. "
              + "Milestones, ambitions, or a bucket list. My personal vision or mission in life.",
          "reflecting on a meaningful personal story, memory, or significant past life "
              + "experience. A transformative event or milestone that shaped me. A defining "
              + "moment, a lesson learned from my childhood, or a memory from growing up that I "
              + "cherish.",
          "sharing my personal background, like my hometown, childhood upbringing, or "
              + "education. My cultural heritage, ethnicity, or where I grew up. Information "
              + "about the university I graduated from or formative life experiences that define "
              + "my identity.",
          "asking for personal advice about a specific life situation, relationship, family "
              + "decision, or career choice. Seeking guidance on a personal challenge, problem, "
              + "or dilemma I'm facing. Needing help or counsel on a difficult issue or conflict.",
          "requesting personalized recommendations based on my stated context, preferences, "
              + "or needs. For example, suggesting a movie based on genres I like, or a "
              + "restaurant that fits my dietary restrictions, budget, and location requirements.",
          "talking about my personal learning journey or educational pursuits. A course or "
              + "class I'm taking, a certification I'm working on, or a degree program. My "
              + "efforts in personal development, skill acquisition, or knowledge building.",
          "discussing my child, spouse, or other family member's interests or needs. "
              + "Helping my son with a school project, finding a hobby for my daughter, or "
              + "supporting my partner's career goals. Questions related to supporting my loved "
              + "ones.",
          "describing my personal challenges with a work task, learning a new skill, or a "
              + "technology problem. Feeling confused, stressed, or overwhelmed. Dealing with "
              + "imposter syndrome, self-doubt, or needing assistance with a difficult project.",
          "planning a personal event like a party, celebration, or family gathering. "
              + "Organizing my daughter's birthday, my son's graduation, or a wedding "
              + "anniversary. Discussing arrangements for a special occasion or festive milestone "
              + "commemoration.",
          "mentioning my pet, such as my dog, cat, or another animal companion. I adopted a "
              + "puppy, or I have a cat named Luna. Discussing my pet's breed, age, behavior, or "
              + "my general feelings about animals, pet care, and pet ownership.",
          "discussing moving or relocating to a new city, state, or country. I just moved "
              + "into a new apartment or house. The personal reasons for my move, like a job or "
              + "family. The process of settling into a new home, neighborhood, or location.",
          "stating my long-term dietary preference or restriction, such as being "
              + "vegetarian, vegan, pescatarian, gluten-free, or having a food allergy. My eating "
              + "habits and favorite cuisines, based on health, ethical, or personal reasons.",
          "talking about my religious or cultural practices. I celebrate Christmas, observe "
              + "Ramadan, or follow Buddhist traditions. My faith, beliefs, spirituality, or "
              + "cultural background. Religious identity, worship, prayers, rituals, or holidays.",
          "describing my living situation. I live with roommates, alone, with my parents, "
              + "or with a partner. I bought or rented a house or apartment. My home environment, "
              + "housing arrangements, and household composition in my current residence.",
          "talking about my personal finances, such as saving for a down payment on a "
              + "house, managing a tight budget, or planning for retirement. My investment goals, "
              + "strategies for handling debt, or my general approach to financial security.",
          "working on a personal creative project. I am writing a novel, composing music, "
              + "painting a picture, or developing a side project. A meaningful creative pursuit "
              + "or hobby that involves a personal, emotional investment and artistic expression.",
          "describing my fitness routine or exercise habits. I go to the gym, run, do yoga, "
              + "or swim regularly. My consistent activities for health and wellness, my workout "
              + "regimen, or my training schedule and fitness goals for an active lifestyle.",
          "sharing my personal values and what I care about deeply. I believe strongly in "
              + "environmental sustainability, social justice, or equality. Causes I support, my "
              + "principles, ethics, morals, and convictions that shape my worldview and "
              + "priorities.",
          "discussing a personal achievement or milestone. I got promoted, received an "
              + "award, won a competition, or completed a marathon. A significant accomplishment "
              + "I am proud of, a goal I reached, or a success that marked a personal triumph.",
          "referencing my social preferences. I am an introvert, an extrovert, or an "
              + "ambivert. I prefer small groups over large crowds. My personality trait "
              + "regarding socializing, my interaction style, and where I get my energy in social "
              + "settings.",
          "discussing everyday problems or logistics. Dealing with a car repair, a "
              + "household issue like a broken appliance, losing my keys, managing appointments, "
              + "or troubleshooting a personal device. Life's daily challenges and practical "
              + "solutions.");

  public static final List<String> TECHNICAL =
      List.of(
          "programming language syntax, data types like string or integer, algorithm logic, "
              + "function, method, programming class, object-oriented paradigm, variable scope, "
              + "control flow, import, module, package, library, framework, recursion, iteration",
          "software design patterns, creational: singleton, factory, builder; structural: "
              + "adapter, decorator, facade, proxy; behavioral: observer, strategy, command, "
              + "mediator, chain of responsibility; abstract interface, polymorphism, composition",
          "error handling, exception, stack trace, TypeError, NullPointerException, "
              + "IndexError, segmentation fault, core dump, stack overflow, runtime vs "
              + "compile-time error, assertion failed, syntax error, null pointer dereference, "
              + "memory leak, bug",
          "HTTP status codes: 404 Not Found, 500 Internal Server Error, 403 Forbidden, 401 "
              + "Unauthorized, 200 OK, 201 Created. API response, 502 Bad Gateway, 503 Service "
              + "Unavailable, 400 Bad Request, 429 Too Many Requests, timeout, CORS",
          "terminal command line shell prompt, bash, zsh, powershell, cmd. Filesystem "
              + "navigation: cd, ls, pwd. File management: mkdir, rm, cp, mv, chmod, chown. Text "
              + "processing with grep, sed, awk, cat. User permissions: sudo, root access",
          "developer CLI tools, package manager, install, update. Network requests with "
              + "curl, wget. Secure shell access with SSH. Version control with git: clone, "
              + "commit, push, pull. Containerization with docker: run, build, compose; npm, pip",
          "data interchange formats, serialization, deserialization, parsing. JSON object, "
              + "array, key-value pair. XML tags, attributes. YAML indentation, TOML, CSV, .ini "
              + "properties. Config file, env variables, dictionary, map, protocol buffers",
          "WebSocket real-time bidirectional communication, server-client connection on a "
              + "port, binary message protocol, handshake, HTTP upgrade, socket programming, TCP, "
              + "UDP, listening, binding, accepting, streaming, pub-sub, broadcast channel",
          "API design, endpoint, REST, GraphQL, SOAP, RPC. HTTP methods: GET, POST, PUT, "
              + "DELETE, PATCH. Request-response cycle, payload, authentication token, bearer, "
              + "JWT, OAuth, API key, query parameters, path variables, request body",
          "file system path, directory structure, config log bin, absolute vs relative "
              + "path, operating system, filesystem, mount point, home, /tmp, /var, shared "
              + "library, symbolic link, inode, file permissions, owner, group, read write "
              + "execute",
          "algorithm analysis, O(log n) time complexity, space complexity, data structures, "
              + "hash table, array, linked list, queue, stack, heap, priority queue, graph, "
              + "adjacency matrix, depth-first search (DFS), breadth-first search (BFS)",
          "sorting algorithms performance and implementation, including merge sort, "
              + "quicksort, insertion sort, selection sort. Understanding stable vs unstable "
              + "sorts, in-place operations, comparison-based sorting, and computational "
              + "complexity",
          "markdown syntax for text formatting, horizontal rule, separator using dashes, "
              + "headings, fenced code block with triple backticks, inline code, emphasis with "
              + "bold and italic, strikethrough, blockquote, nested list, task list, markdown "
              + "table",
          "code formatting and style, indentation with whitespace, tabs vs spaces, nested "
              + "function body, class method, structured code, syntax highlighting for languages "
              + "like Python, JavaScript, Java, C++, Go, Rust, TypeScript, Prettier, ESLint",
          "container orchestration, cluster management, service scaling, replication, load "
              + "balancing, namespace, pod, deployment, infrastructure, Kubernetes (K8s), Docker "
              + "Swarm, container runtime (CRI-O, containerd), image registry, Dockerfile",
          "querying a database, SQL statement, database table, column, row, index, primary "
              + "key, foreign key relationship, join, filter, select, insert, update, delete, "
              + "relational vs NoSQL, MongoDB, PostgreSQL, MySQL, Redis, schema, transaction",
          "application logging, log output, stack trace levels like INFO, WARN, ERROR, "
              + "DEBUG, FATAL. Log message components: timestamp, module, line number. Diagnostic "
              + "telemetry, monitoring, and observability for system health and debugging",
          "regex pattern, regular expression matching, groups, capturing, backslash "
              + "escapes, metacharacters, wildcards, quantifiers, character classes, lookaheads, "
              + "lookbehinds, alternation, anchors, word boundary, multiline flag, global search",
          "software testing, unit test, assertion, mock, stub, fixture, test suite, test "
              + "case, verification, automated QA, validation framework, JUnit, pytest, Jest. "
              + "Integration, end-to-end (E2E), functional, regression, acceptance testing",
          "cloud computing platforms, infrastructure as a service (IaaS), PaaS, AWS, Azure, "
              + "GCP, compute instance, region, availability zone, elasticity, distributed "
              + "system, virtual machine, container, serverless, Lambda, edge computing, CDN");

  public static final List<String> INSTRUCTION =
      List.of(
          "format the output as structured data. Return the answer as JSON with specific "
              + "keys and values, or as YAML. Organize information into a CSV file or a "
              + "database-style table with columns and rows. Present as a list of objects or an "
              + "array.",
          "style the text presentation. Use markdown formatting like bullet points, a "
              + "numbered list, or a task list. Organize content into a grid or tabular layout "
              + "with proper alignment. Create a hierarchical structure with nested elements for "
              + "clarity.",
          "adjust the response length. Make the answer shorter, more concise, brief, or "
              + "condensed. Summarize the key points. Trim down the text to reduce the overall "
              + "word count or meet a specific character limit. Be less verbose and more direct.",
          "change the explanation depth. Make the response more detailed, comprehensive, "
              + "and elaborate. Expand on previous points and go into more depth. Provide a "
              + "thorough, in-depth analysis. Explain the topic with more complexity and nuance.",
          "rewrite the previous response. Rephrase, paraphrase, or reformulate the answer "
              + "using different wording. Restate the information in another way to offer an "
              + "alternative perspective. Express the same meaning but with a new structure or "
              + "vocabulary.",
          "alter the response tone. Change the writing style to be more formal, academic, "
              + "or professional. Alternatively, make it more casual, friendly, and "
              + "conversational. Adapt the register and voice to suit a specific audience or "
              + "context level.",
          "explain the concept in simpler terms. Break down the topic step-by-step for a "
              + "beginner. Clarify a confusing point. Explain it like I'm five years old (ELI5). "
              + "Use an analogy or a concrete example to help me understand the idea clearly.",
          "continue the generated response. Keep going with the explanation or list. "
              + "Provide more information and finish your thought. Complete the rest of the "
              + "content or story. Proceed with the next steps. Do not stop until you have "
              + "concluded.",
          "act as a specific persona or role. Respond as if you were a pirate, a scientist, "
              + "or a travel guide. Adopt the character's voice, style, and knowledge base in "
              + "your answer. Maintain the persona throughout the entire response.",
          "compare and contrast two or more topics. Explain the similarities and "
              + "differences between A and B. Provide a detailed analysis of what they have in "
              + "common and how they diverge. Create a table to highlight the key distinctions.");

  public static final List<String> ARITHMETIC =
      List.of(
          "perform a pure arithmetic calculation with explicit numbers. Solve, multiply, "
              + "add, subtract, and divide. Compute a numeric expression following the order of "
              + "operations (PEMDAS/BODMAS). What is 23 plus 456 minus 78 times 9 divided by 3?",
          "evaluate a mathematical expression containing numbers and operators, such as 2 "
              + "plus 3 times 4 divided by 5. Solve this numerical problem and compute the final "
              + "result. Simplify the arithmetic and show the final answer. Calculate 123 * 456.",
          "convert units between measurement systems with numeric values. Convert 100 "
              + "kilometers to miles, 72 fahrenheit to celsius, or 5 feet 9 inches to "
              + "centimeters. Change between metric and imperial for distance, weight, volume, or "
              + "temperature.",
          "calculate a percentage of a number. What is 25 percent of 800? Determine the "
              + "price after a 30% discount. Compute a 15% tip on a $65.40 bill. Find the value "
              + "corresponding to a specific proportion or calculate sales tax or interest.",
          "solve an algebraic equation for a variable like x. For the equation 2x + 5 = 15, "
              + "find the value of x. Use the quadratic formula for numeric values. Solve "
              + "simultaneous linear equations to find the value of the unknown variables. "
              + "Isolate x.",
          "perform a geometry calculation with numeric measurements. Find the area of a "
              + "circle with a radius of 5, or the volume of a cube with a side of 10. Calculate "
              + "the circumference, perimeter, or diameter. What is the square root of 144?",
          "calculate compound interest on an investment or savings. With a principal of "
              + "$5000 at an annual rate of 4% for 10 years, what is the future value? Compute a "
              + "monthly mortgage payment for a $300,000 loan. Financial calculation, ROI, APR.",
          "compute descriptive statistics for a dataset of numbers like 12, 15, 18, 20, 22. "
              + "Calculate the mean, median, mode, average, and standard deviation. Find the "
              + "variance, range, quartiles, and percentiles for a given sample distribution.",
          "calculate health and fitness metrics using a numeric formula. Compute the Body "
              + "Mass Index (BMI) given a weight in pounds or kilograms and height in feet, "
              + "inches, or meters. Find my basal metabolic rate (BMR) or target heart rate.",
          "calculate the time difference between two dates. How many days, hours, or "
              + "minutes are between two points in time? Find the duration or elapsed time. Act "
              + "as an age calculator for a birthday or find the time until a future anniversary.");

  public static final List<String> TRANSLATION =
      List.of(
          "translate the explicitly quoted text 'Hello, how are you?' to a foreign language "
              + "like Spanish, French, or German. This is a translation instruction that includes "
              + "the word 'translate' and the source text in quotes for direct conversion.",
          "how do you say a specific word or phrase in another language? For example, how "
              + "do you say 'thank you', 'computer', or 'goodbye' in Japanese, Chinese, or "
              + "Korean? This is a request for a direct translation of a common expression or "
              + "term.",
          "convert a block of text or a paragraph from a source language to a target "
              + "language. Translate the following content to Italian, Arabic, Portuguese, or "
              + "Russian. This is a language conversion request for a larger piece of text "
              + "provided.",
          "provide the translation for the sentence 'Where is the train station?' into a "
              + "specific foreign language like Turkish, Hindi, or Polish. This is a translation "
              + "request for a complete sentence, often enclosed in quotes or brackets for "
              + "clarity.",
          "what is the translation of the source text 'The quick brown fox jumps over the "
              + "lazy dog' into a target language? Give me the resulting translated output in "
              + "German, French, or Dutch. This is a query for the translated equivalent of a "
              + "text.",
          "translate the following passage to Spanish. This is an instruction to convert "
              + "the provided text content into a specified foreign language. The request uses a "
              + "direct command format, indicating a clear source and a clear target language.",
          "what is the foreign language word for 'house', 'beautiful', or 'water'? Provide "
              + "the translation for these common vocabulary words in Italian, Swedish, or "
              + "another language. This is a request for single-word vocabulary translation.",
          "how do I say 'I am learning to code' in German? Convert this specific English "
              + "phrase into its equivalent in another language. This is a request for a "
              + "practical, conversational phrase translation for personal or professional use.",
          "translate this informal or slang expression to its colloquial equivalent in "
              + "Spanish. How would you say 'What's up?' in Japanese in a casual context? This "
              + "request focuses on capturing the correct tone and nuance of informal language.",
          "provide the formal and professional translation for 'Please find the attached "
              + "document for your review' in French. Translate this business email phrase to "
              + "German, ensuring the terminology and register are appropriate for a corporate "
              + "context.");

  public static final List<String> GRAMMAR =
      List.of(
          "proofread the following text for errors. Here is my draft, please check it for "
              + "typos and mistakes: 'Teh quick brown fox jumpped'. Review, revise, and correct "
              + "any misspellings or grammatical issues you find in the provided passage.",
          "correct the grammar in this sentence: 'She don't like it'. Resolve grammatical "
              + "issues like subject-verb agreement, incorrect verb tense, pronoun reference "
              + "errors, or misplaced modifiers in the provided text. Address faulty sentence "
              + "structure.",
          "check the spelling and punctuation in this passage. Please review the following "
              + "text and correct any textual errors: 'its a beautiful day, isnt it'. Amend "
              + "mistakes with commas, periods, apostrophes, quotation marks, colons, or "
              + "capitalization.",
          "review this sentence and tell me if it is grammatically correct. Is the sentence "
              + "'There going to they're house' proper? Validate the grammar, check word usage "
              + "(like their/there/they're), and verify that the sentence is well-formed.",
          "proofread my email before I send it. Here is the draft. Please check for "
              + "clarity, flow, coherence, and readability. Improve my writing, make it better, "
              + "and polish the text to ensure it sounds professional and is free of textual "
              + "errors.",
          "fix the punctuation in this run-on sentence or comma splice. Correct sentence "
              + "fragments and ensure proper use of capitalization. Address errors with "
              + "apostrophes, quotation marks, periods, semicolons, dashes, and other punctuation "
              + "marks.",
          "suggest a better word choice or alternative phrasing. Can you help me improve my "
              + "vocabulary and diction in this sentence? Replace words with more precise or "
              + "impactful synonyms. Refine the expression for better clarity, tone, or style.",
          "rewrite this sentence from passive voice to active voice. Help me make my "
              + "writing more direct and concise by eliminating passive constructions. "
              + "Restructure the sentence to be more engaging and clear. Identify and fix faulty "
              + "parallelism.",
          "improve the clarity and flow of this paragraph. Make the writing smoother and "
              + "more readable. Restructure the sentences for better coherence and logical "
              + "progression. Ensure the ideas connect seamlessly and eliminate any awkward "
              + "phrasing.",
          "check my essay for conciseness and remove any redundancy. Help me edit this text "
              + "to be more direct and to the point. Identify and eliminate wordiness, filler "
              + "words, and repetitive phrases to strengthen the overall quality of the writing.");

  /** The personal anchor group. */
  public static ReferenceCategory personal() {
    return new ReferenceCategory(null, PERSONAL);
  }

  /** Skip categories for the given granularity. */
  public static List<ReferenceCategory> skipCategories(ClassifierGranularity granularity) {
    if (granularity == ClassifierGranularity.CATEGORIZED) {
      return List.of(
          new ReferenceCategory(SkipReason.TECHNICAL, TECHNICAL),
          new ReferenceCategory(SkipReason.INSTRUCTION, INSTRUCTION),
          new ReferenceCategory(SkipReason.ARITHMETIC, ARITHMETIC),
          new ReferenceCategory(SkipReason.TRANSLATION, TRANSLATION),
          new ReferenceCategory(SkipReason.GRAMMAR, GRAMMAR));
    }
    return List.of(new ReferenceCategory(SkipReason.NON_PERSONAL, allNonPersonal()));
  }

  /** Every non-personal exemplar in one list. */
  public static List<String> allNonPersonal() {
    return Stream.of(TECHNICAL, INSTRUCTION, ARITHMETIC, TRANSLATION, GRAMMAR)
        .flatMap(List::stream)
        .toList();
  }
}
